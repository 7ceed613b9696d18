/*
 *  Copyright 2026 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.workflownotifier.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

public final class WebhookConfig {
    public static final Duration DEFAULT_CALLBACK_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI url;
    private final Duration callbackRequestTimeout;

    @JsonCreator
    public WebhookConfig(
            @JsonProperty("url") URI url,
            @JsonProperty("callbackRequestTimeout") @Nullable Duration callbackRequestTimeout) {
        this.url = Objects.requireNonNull(url, "webhook url");
        this.callbackRequestTimeout = callbackRequestTimeout == null
                ? DEFAULT_CALLBACK_REQUEST_TIMEOUT
                : callbackRequestTimeout;
    }

    public URI getUrl() {
        return url;
    }

    public Duration getCallbackRequestTimeout() {
        return callbackRequestTimeout;
    }

    @Override
    public String toString() {
        return "WebhookConfig{" +
                "url=" + url +
                ", callbackRequestTimeout=" + callbackRequestTimeout +
                '}';
    }
}
