/***********************************************************************
 * This file is part of VideoBatch.
 *
 * VideoBatch is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * VideoBatch is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with VideoBatch.  If not, see <http://www.gnu.org/licenses/>.
 ************************************************************************/

package org.cripac.isee.videobatch.util;

import javax.annotation.Nonnull;

/**
 * The class LazyReference holds a single value that is produced by a {@link Factory}
 * on the first call of {@link #get()} and shared by every later caller.
 * <p>
 * Unlike a process-wide instance pool, each reference is owned by whoever creates it,
 * so two independent owners never see each other's values.
 *
 * @param <T> The type of the value.
 */
public class LazyReference<T> {

    /**
     * Factory for creating the value on first use.
     */
    private final Factory<? extends T> objFactory;

    private volatile T value = null;

    public LazyReference(@Nonnull Factory<? extends T> objFactory) {
        this.objFactory = objFactory;
    }

    /**
     * Get the value, producing it if this is the first call.
     *
     * @return The shared value.
     * @throws Exception On failure creating the value. A later call retries.
     */
    @Nonnull
    public T get() throws Exception {
        T result = value;
        if (result == null) {
            synchronized (this) {
                result = value;
                if (result == null) {
                    result = objFactory.produce();
                    value = result;
                }
            }
        }
        return result;
    }

    /**
     * @return Whether the value has already been produced.
     */
    public boolean isInitialized() {
        return value != null;
    }
}
