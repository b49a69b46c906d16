package com.toolstock.notifier.transport;

/** Builds a fresh, unconnected {@link ChatTransport}. */
@FunctionalInterface
public interface ChatTransportFactory {

    ChatTransport create();
}
