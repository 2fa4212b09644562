package exceptions;

public class CallerCancelledException extends RuntimeException {

    public CallerCancelledException(Object key, Throwable cause) {
        super("Caller stopped waiting for in-flight call with key = {" + key + "}", cause);
    }
}
