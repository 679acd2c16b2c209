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

package ai.kognition.stitchgeom.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for reading layered {@link Properties} based configuration. Values are resolved
 * from (lowest to highest precedence) a {@link Properties} instance typically read from the
 * classpath, then an environment variable, then a system property. This is the same scheme
 * used for {@code stitchgeom.track-memory-leaks} / {@code STITCHGEOM_TRACK_MEMORY_LEAKS}.
 */
public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(sectionName + separator)) {
                final String newkey = removeSectionName ? key.substring(sectionName.length() + 1) : key;

                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * Read the named resource from the classpath. A missing resource isn't an error and results
     * in an empty {@link Properties}. A resource that's present but can't be read is.
     */
    public static Properties loadFromClasspath(final String resource) {
        final Properties ret = new Properties();
        try(InputStream is = PropertiesUtils.class.getClassLoader().getResourceAsStream(resource)) {
            if(is == null) {
                LOGGER.debug("No \"{}\" on the classpath. Using defaults.", resource);
                return ret;
            }
            ret.load(is);
        } catch(final IOException e) {
            throw new IllegalStateException("Problem loading the properties file \"" + resource + "\" from the classpath", e);
        }
        LOGGER.debug("Loaded {} entries from \"{}\"", ret.size(), resource);
        return ret;
    }

    /**
     * Look up {@code prefix.key} checking the system properties first, then the environment
     * variable (upper case with '.' and '-' replaced by '_'), and finally {@code props} using the
     * bare {@code key}. Returns null when nothing is set.
     */
    public static String lookup(final Properties props, final String prefix, final String key) {
        final String qualified = prefix + separator + key;
        final String sysProp = System.getProperty(qualified);
        if(sysProp != null)
            return sysProp;

        final String envVal = System.getenv(envName(qualified));
        if(envVal != null)
            return envVal;

        return props == null ? null : props.getProperty(key);
    }

    public static String envName(final String qualifiedKey) {
        return qualifiedKey.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public static double getDouble(final Properties props, final String prefix, final String key, final double defaultValue) {
        final String val = lookup(props, prefix, key);
        if(val == null)
            return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalStateException("The value \"" + val + "\" for \"" + prefix + separator + key + "\" isn't a valid number", nfe);
        }
    }

    public static int getInt(final Properties props, final String prefix, final String key, final int defaultValue) {
        final String val = lookup(props, prefix, key);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalStateException("The value \"" + val + "\" for \"" + prefix + separator + key + "\" isn't a valid integer", nfe);
        }
    }

    // An empty value counts as true so that -Dprefix.key alone turns a flag on.
    public static boolean getBoolean(final Properties props, final String prefix, final String key, final boolean defaultValue) {
        final String val = lookup(props, prefix, key);
        if(val == null)
            return defaultValue;
        final String trimmed = val.trim();
        if("".equals(trimmed) || "true".equalsIgnoreCase(trimmed))
            return true;
        if("false".equalsIgnoreCase(trimmed))
            return false;
        throw new IllegalStateException("The value \"" + val + "\" for \"" + prefix + separator + key + "\" isn't a valid boolean");
    }
}
