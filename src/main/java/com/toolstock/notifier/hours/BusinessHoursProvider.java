package com.toolstock.notifier.hours;

import com.toolstock.notifier.scheduling.ScheduledHandle;
import com.toolstock.notifier.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Hands out the current {@link BusinessHoursOracle} and reloads the calendar
 * file periodically.
 *
 * <p>The first load falls back to {@link BusinessHoursConfig#defaults()} when
 * the file is missing or invalid. A failed reload keeps the previous calendar.
 */
public class BusinessHoursProvider implements Supplier<BusinessHoursOracle>, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BusinessHoursProvider.class);

    private final Path                                 file;
    private final BusinessHoursLoader                  loader;
    private final AtomicReference<BusinessHoursOracle> current = new AtomicReference<>();
    private volatile ScheduledHandle                   reloadHandle;

    public BusinessHoursProvider(final Path file, final BusinessHoursLoader loader) {
        this.file   = file;
        this.loader = loader;
        current.set(new BusinessHoursOracle(initialConfig()));
    }

    /** A provider with a fixed calendar and no file behind it. */
    public static BusinessHoursProvider fixed(final BusinessHoursConfig config) {
        return new BusinessHoursProvider(config);
    }

    private BusinessHoursProvider(final BusinessHoursConfig config) {
        this.file   = null;
        this.loader = null;
        current.set(new BusinessHoursOracle(config));
    }

    private BusinessHoursConfig initialConfig() {
        try {
            final BusinessHoursConfig config = loader.load(file);
            LOG.info("Business hours loaded from {} (zone={})", file, config.getTimezone());
            return config;
        } catch (Exception e) {
            LOG.error("Could not load business hours from {}, using the built-in calendar: {}",
                    file, e.getMessage());
            return BusinessHoursConfig.defaults();
        }
    }

    public void startReloading(final TaskScheduler scheduler, final Duration interval) {
        if (file == null || reloadHandle != null) {
            return;
        }
        reloadHandle = scheduler.scheduleAtFixedRate(this::reload, interval, interval);
    }

    /** @return {@code true} if the file was read and the calendar replaced */
    public boolean reload() {
        if (file == null) {
            return false;
        }
        try {
            current.set(new BusinessHoursOracle(loader.load(file)));
            LOG.info("Business hours reloaded from {}", file);
            return true;
        } catch (Exception e) {
            LOG.warn("Business hours reload from {} failed, keeping the previous calendar: {}",
                    file, e.getMessage());
            return false;
        }
    }

    @Override
    public BusinessHoursOracle get() {
        return current.get();
    }

    @Override
    public void close() {
        final ScheduledHandle handle = reloadHandle;
        if (handle != null) {
            handle.cancel();
            reloadHandle = null;
        }
    }
}
