/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracebridge.agent.configuration.source;

import org.stagemonitor.configuration.source.AbstractConfigurationSource;

import javax.annotation.Nullable;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * A read only variation of {@link org.stagemonitor.configuration.source.PropertyFileConfigurationSource} which does not initialize a logger.
 * <p>
 * The file is looked up on the classpath first, then on the file system.
 * </p>
 */
public final class PropertyFileConfigurationSource extends AbstractConfigurationSource {

    private final String location;
    private Properties properties;

    public PropertyFileConfigurationSource(String location) {
        this.location = location;
        reload();
    }

    public static boolean isPresent(String location) {
        return getProperties(location) != null;
    }

    @Nullable
    private static Properties getProperties(String location) {
        Properties props = getFromClasspath(location, PropertyFileConfigurationSource.class.getClassLoader());
        if (props == null) {
            props = getFromFileSystem(location);
        }
        return props;
    }

    @Nullable
    static Properties getFromClasspath(String classpathLocation, ClassLoader classLoader) {
        final Properties props = new Properties();
        try (InputStream resourceStream = classLoader.getResourceAsStream(classpathLocation)) {
            if (resourceStream != null) {
                props.load(resourceStream);
                return props;
            }
        } catch (IOException e) {
            // logging is not initialized yet
            e.printStackTrace();
        }
        return null;
    }

    @Nullable
    private static Properties getFromFileSystem(String location) {
        Properties props = new Properties();
        try (InputStream input = new FileInputStream(location)) {
            props.load(input);
            return props;
        } catch (FileNotFoundException ex) {
            return null;
        } catch (IOException e) {
            e.printStackTrace();
        }
        return null;
    }

    @Override
    public void reload() {
        Properties reloaded = getProperties(location);
        properties = reloaded != null ? reloaded : new Properties();
    }

    @Override
    public String getName() {
        return location;
    }

    @Override
    public String getValue(String key) {
        return properties.getProperty(key);
    }
}
