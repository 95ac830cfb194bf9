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
package co.tracebridge.agent.configuration;

import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.converter.UrlValueConverter;

import javax.annotation.Nullable;
import java.net.URL;

public class ReporterConfiguration extends ConfigurationOptionProvider {

    public static final String REPORTER_CATEGORY = "Reporter";
    public static final String SERVER_URL = "server_url";

    private final ConfigurationOption<URL> serverUrl = ConfigurationOption.urlOption()
        .key(SERVER_URL)
        .configurationCategory(REPORTER_CATEGORY)
        .label("The URL of the ingestion endpoint")
        .description("The URL must be fully qualified, including protocol (http or https) and port.\n" +
            "\n" +
            "Outgoing requests to this URL are never traced, even if the HTTP client in use is instrumented.")
        .dynamic(false)
        .buildWithDefault(UrlValueConverter.INSTANCE.convert("http://localhost:8200"));

    public URL getServerUrl() {
        return serverUrl.get();
    }

    /**
     * Determines whether a request targets the ingestion endpoint of the tracing backend.
     *
     * @param url the full URL of an outgoing request
     * @return {@code true} if the URL starts with the configured {@link #getServerUrl() server URL}
     */
    public boolean isIngestionUrl(@Nullable String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        String server = getServerUrl().toString();
        if (server.endsWith("/")) {
            server = server.substring(0, server.length() - 1);
        }
        if (!url.regionMatches(true, 0, server, 0, server.length())) {
            return false;
        }
        if (url.length() == server.length()) {
            return true;
        }
        char next = url.charAt(server.length());
        return next == '/' || next == '?' || next == '#';
    }
}
