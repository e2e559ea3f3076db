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

package org.cripac.isee.videobatch.ctrl;

import org.cripac.isee.videobatch.batch.BatchCommand;
import org.cripac.isee.videobatch.batch.BatchEnvironment;
import org.cripac.isee.videobatch.common.ConfigurationException;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The CommandRegistry class maps the names used in the <code>command</code> key of a
 * configuration to the factories of the commands.
 */
public class CommandRegistry {

    private static class Entry {
        final String description;
        final CommandFactory factory;

        Entry(String description, CommandFactory factory) {
            this.description = description;
            this.factory = factory;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException If the name is already taken.
     */
    public CommandRegistry register(@Nonnull String name,
                                    @Nonnull String description,
                                    @Nonnull CommandFactory factory) {
        if (entries.containsKey(name)) {
            throw new IllegalArgumentException("Command " + name + " is already registered");
        }
        entries.put(name, new Entry(description, factory));
        return this;
    }

    public boolean contains(@Nonnull String name) {
        return entries.containsKey(name);
    }

    /**
     * @return Registered names, in registration order.
     */
    @Nonnull
    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @Nonnull
    public String getDescription(@Nonnull String name) throws ConfigurationException {
        return lookup(name).description;
    }

    /**
     * Build the command named in the configuration.
     *
     * @throws ConfigurationException If the name is unknown.
     * @throws Exception              On failure building the command.
     */
    @Nonnull
    public BatchCommand create(@Nonnull BatchConfig config, @Nonnull BatchEnvironment env) throws Exception {
        String name = config.getCommand();
        env.getLogger().debug("Searching command " + name + "...");
        return lookup(name).factory.create(config, env);
    }

    private Entry lookup(String name) throws ConfigurationException {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new ConfigurationException("Unknown command " + name + "; choose one of " + entries.keySet());
        }
        return entry;
    }
}
