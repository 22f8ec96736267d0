package io.github.flameyossnowy.dynrel.api.exceptions;

public class UndefinedMethodException extends RuntimeException {
    private final String methodName;

    public UndefinedMethodException(Class<?> modelType, String methodName) {
        super("Call to undefined method " + modelType.getName() + "::" + methodName + "()");
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }
}
