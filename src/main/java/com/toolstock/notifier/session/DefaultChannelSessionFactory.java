package com.toolstock.notifier.session;

import com.toolstock.notifier.scheduling.TaskScheduler;
import com.toolstock.notifier.transport.ChatTransportFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** One event-loop thread and one I/O pool per session, named after its generation. */
public class DefaultChannelSessionFactory implements ChannelSessionFactory {

    private final ChatTransportFactory transports;
    private final SessionSettings      settings;
    private final TaskScheduler        scheduler;
    private final ConnectionHistory    history;
    private final AtomicInteger        generations = new AtomicInteger();

    public DefaultChannelSessionFactory(
            final ChatTransportFactory transports,
            final SessionSettings settings,
            final TaskScheduler scheduler,
            final ConnectionHistory history) {
        this.transports = transports;
        this.settings   = settings;
        this.scheduler  = scheduler;
        this.history    = history;
    }

    @Override
    public ChannelSession create() {
        final int generation = generations.incrementAndGet();
        final ExecutorService eventLoop = Executors.newSingleThreadExecutor(
                daemon("session-" + generation + "-events"));
        final AtomicInteger ioThreads = new AtomicInteger();
        final ExecutorService io = Executors.newCachedThreadPool(
                r -> {
                    final Thread t = new Thread(r, "session-" + generation + "-io-" + ioThreads.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        return new ChannelSession(generation, transports.create(), settings, scheduler, history, eventLoop, io);
    }

    private static ThreadFactory daemon(final String name) {
        return r -> {
            final Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
