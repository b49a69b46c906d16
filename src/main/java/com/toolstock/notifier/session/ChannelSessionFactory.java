package com.toolstock.notifier.session;

/** Builds a fresh, idle {@link ChannelSession} around a new transport. */
@FunctionalInterface
public interface ChannelSessionFactory {

    ChannelSession create();
}
