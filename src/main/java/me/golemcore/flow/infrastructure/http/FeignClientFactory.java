/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.flow.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Builds declarative Feign clients for the SaaS-backed agent tools (Slack,
 * Google Sheets) on top of the shared OkHttp transport and Jackson mapper.
 *
 * <pre>{@code
 * SlackApi api = factory.create(SlackApi.class, "https://slack.com", 30);
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T create(Class<T> apiType, String baseUrl) {
        return builder().target(apiType, baseUrl);
    }

    /**
     * Create a client whose connect and read timeouts are bounded by the given
     * number of seconds.
     */
    public <T> T create(Class<T> apiType, String baseUrl, int timeoutSeconds) {
        return builder()
                .options(new Request.Options(timeoutSeconds, TimeUnit.SECONDS, timeoutSeconds, TimeUnit.SECONDS, true))
                .target(apiType, baseUrl);
    }

    private Feign.Builder builder() {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper));
    }
}
