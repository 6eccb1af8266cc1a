package io.github.goodees.wiretap.runner;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared request to stop. Runners observe it between batches and while waiting.
 */
public class ShutdownSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    /**
     * Wait for the signal at most given time.
     * @param timeout maximum wait
     * @return true if signal was triggered
     * @throws InterruptedException when waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
