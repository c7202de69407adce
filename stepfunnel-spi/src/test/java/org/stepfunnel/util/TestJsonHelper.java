/*
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
 */
package org.stepfunnel.util;

import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.testng.Assert.assertEquals;

public class TestJsonHelper {
    @Test
    public void testDatesAreIsoStrings() {
        assertEquals(JsonHelper.encode(ImmutableMap.of("start_date", LocalDate.of(2024, 1, 1))), "{\"start_date\":\"2024-01-01\"}");
    }

    @Test
    public void testUnknownPropertiesAreIgnored() {
        Map<?, ?> map = JsonHelper.read("{\"a\": 1}", Map.class);
        assertEquals(map.get("a"), 1);
    }

    @Test(expectedExceptions = StepFunnelException.class)
    public void testMalformedJson() {
        JsonHelper.read("{\"a\": ", Map.class);
    }
}
