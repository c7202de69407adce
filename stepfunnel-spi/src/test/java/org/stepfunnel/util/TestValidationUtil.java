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

import org.testng.annotations.Test;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.fail;

public class TestValidationUtil {
    @Test
    public void testTableId() {
        assertEquals(ValidationUtil.checkTableId("project.analytics_123.events_*"), "project.analytics_123.events_*");
    }

    @Test(expectedExceptions = StepFunnelException.class)
    public void testTableIdWithBacktick() {
        ValidationUtil.checkTableId("project.dataset.events` WHERE 1=1 --");
    }

    @Test(expectedExceptions = StepFunnelException.class)
    public void testEmptyTableId() {
        ValidationUtil.checkTableId("");
    }

    @Test
    public void testStatusCode() {
        try {
            ValidationUtil.checkColumn(null, "grouping key");
            fail("null column must be rejected");
        } catch (StepFunnelException e) {
            assertEquals(e.getStatusCode(), BAD_REQUEST);
            assertEquals(e.getMessage(), "grouping key is null");
        }
    }
}
