package slackauth.domain.timeout;

@FunctionalInterface
public interface TimeoutFunctionCallback<T> {
    T apply();
}
