package io.herald.cli;

@FunctionalInterface
public interface DaemonRunner {
    int run(Integer statusPortOverride) throws Exception;
}
