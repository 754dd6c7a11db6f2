/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pixelfilter.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Layered key/value configuration. A value for {@code key} is resolved, in order, from:
 * </p>
 *
 * <ol>
 * <li>the system property {@code pixelfilter.<key>}</li>
 * <li>the environment variable {@code PIXELFILTER_<KEY>} (upper case, with '.' replaced by '_'), which
 * is only consulted when the system property isn't set</li>
 * <li>the defaults, usually loaded from a properties resource on the classpath</li>
 * </ol>
 *
 * <p>
 * For boolean values a system property that's set but empty (e.g. {@code -Dpixelfilter.canny.blur})
 * counts as {@code true}.
 * </p>
 */
public class Settings {
    private static final Logger LOGGER = LoggerFactory.getLogger(Settings.class);

    public static final String SYSTEM_PROPERTY_PREFIX = "pixelfilter.";
    public static final String ENVIRONMENT_PREFIX = "PIXELFILTER_";
    public static final String separator = ".";

    private final Properties defaults;
    private final UnaryOperator<String> systemProperties;
    private final UnaryOperator<String> environment;

    public Settings(final Properties defaults, final UnaryOperator<String> systemProperties, final UnaryOperator<String> environment) {
        this.defaults = copy(defaults);
        this.systemProperties = systemProperties == null ? k -> null : systemProperties;
        this.environment = environment == null ? k -> null : environment;
    }

    /**
     * Defaults from the given {@link Properties}, overridden from the running JVM's system properties and
     * environment.
     */
    public static Settings of(final Properties defaults) {
        return new Settings(defaults, System::getProperty, System::getenv);
    }

    /**
     * Load the defaults from the named classpath resource. A missing resource simply results in no defaults.
     */
    public static Settings load(final String resource) {
        final Properties props = new Properties();
        loadProps(props, resource);
        return of(props);
    }

    /**
     * Fill {@code p} from the classpath resource. Returns false if there's no such resource.
     *
     * @throws UncheckedIOException if the resource exists but can't be read.
     */
    public static boolean loadProps(final Properties p, final String resource) {
        final ClassLoader cl = Settings.class.getClassLoader();
        try(InputStream is = cl.getResourceAsStream(resource);) {
            if(is == null) {
                LOGGER.debug("No settings resource \"{}\" found on the classpath. Using built in defaults.", resource);
                return false;
            }
            p.load(is);
        } catch(final IOException ioe) {
            throw new UncheckedIOException("Couldn't load settings from the resource \"" + resource + "\"", ioe);
        }
        return true;
    }

    public String getString(final String key, final String defaultValue) {
        final String sysOp = systemProperties.apply(SYSTEM_PROPERTY_PREFIX + key);
        if(sysOp != null)
            return sysOp;
        final String envOp = environment.apply(environmentName(key));
        if(envOp != null)
            return envOp;
        return defaults.getProperty(key, defaultValue);
    }

    public boolean getBoolean(final String key, final boolean defaultValue) {
        final String sysOp = systemProperties.apply(SYSTEM_PROPERTY_PREFIX + key);
        if(sysOp != null)
            return "".equals(sysOp.trim()) || Boolean.parseBoolean(sysOp.trim());
        final String value = getString(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    public double getDouble(final String key, final double defaultValue) {
        final String value = getString(key, null);
        if(value == null)
            return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The setting \"" + key + "\" should be a number but is \"" + value + "\"", nfe);
        }
    }

    public int getInt(final String key, final int defaultValue) {
        final String value = getString(key, null);
        if(value == null)
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The setting \"" + key + "\" should be an integer but is \"" + value + "\"", nfe);
        }
    }

    /**
     * A view of all of the keys that start with {@code sectionName + "."} with that prefix removed. Overrides
     * are still looked up using the full key.
     */
    public Settings section(final String sectionName) {
        final String prefix = sectionName + separator;
        final Properties ret = new Properties();

        for(final Enumeration<?> e = defaults.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(prefix))
                ret.setProperty(key.substring(prefix.length()), defaults.getProperty(key));
        }

        return new Settings(ret,
            k -> systemProperties.apply(SYSTEM_PROPERTY_PREFIX + prefix + k.substring(SYSTEM_PROPERTY_PREFIX.length())),
            k -> environment.apply(environmentName(prefix) + k.substring(ENVIRONMENT_PREFIX.length())));
    }

    /**
     * The keys that have defaults.
     */
    public Set<String> keys() {
        return Collections.unmodifiableSet(new TreeSet<>(defaults.stringPropertyNames()));
    }

    public static String environmentName(final String key) {
        return ENVIRONMENT_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private static Properties copy(final Properties props) {
        final Properties ret = new Properties();
        if(props != null)
            props.stringPropertyNames().forEach(k -> ret.setProperty(k, props.getProperty(k)));
        return ret;
    }

    @Override
    public String toString() {
        return "Settings " + defaults;
    }
}
