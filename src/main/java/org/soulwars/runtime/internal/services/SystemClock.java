package org.soulwars.runtime.internal.services;

import org.soulwars.runtime.spi.IClock;

/**
 * Wall-clock time source used by the live tick service.
 */
public final class SystemClock implements IClock {

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
