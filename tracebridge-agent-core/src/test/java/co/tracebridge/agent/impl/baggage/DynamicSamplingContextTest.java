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
package co.tracebridge.agent.impl.baggage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DynamicSamplingContextTest {

    @Test
    void testFromBaggageHeader() {
        Baggage baggage = Baggage.fromHeader("tracebridge-trace_id=abc, tracebridge-environment=prod%20eu;ttl=1, other=value, malformed");
        assertThat(baggage.asMap()).containsOnlyKeys("tracebridge-trace_id", "tracebridge-environment", "other");

        DynamicSamplingContext dsc = DynamicSamplingContext.fromBaggage(baggage);
        assertThat(dsc).isNotNull();
        assertThat(dsc.getItems()).containsOnlyKeys("trace_id", "environment");
        assertThat(dsc.get("environment")).isEqualTo("prod eu");
    }

    @Test
    void testNoSamplingEntries() {
        assertThat(DynamicSamplingContext.fromBaggage(Baggage.builder().put("other", "value").build())).isNull();
        assertThat(DynamicSamplingContext.fromBaggage(Baggage.empty())).isNull();
        assertThat(Baggage.fromHeader(null).isEmpty()).isTrue();
    }
}
