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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;

/**
 * Times a sequence of named stages. Each stage is run to completion through {@link #time(String, Supplier)}
 * and its duration is reported to the given {@link Logger} at {@code trace} level.
 */
public final class StageTimer {
    public static final long nanoSecondsPerSecond = 1000000000L;
    public static final double secondsPerNanosecond = 1.0D / nanoSecondsPerSecond;

    private final Logger logger;
    private final Map<String, Long> durations = new LinkedHashMap<>();
    private long startTime;
    private long endTime;

    public StageTimer(final Logger logger) {
        this.logger = logger;
    }

    public final void start() {
        startTime = System.nanoTime();
    }

    public final String stop() {
        endTime = System.nanoTime();
        return toString();
    }

    public <T> T time(final String stage, final Supplier<T> work) {
        final long stageStart = System.nanoTime();
        final T ret = work.get();
        final long elapsed = System.nanoTime() - stageStart;
        durations.merge(stage, elapsed, Long::sum);
        if(logger != null && logger.isTraceEnabled())
            logger.trace("stage {} took {} seconds", stage, format(elapsed));
        return ret;
    }

    /**
     * The stages run so far, in the order they were first run, with their durations in seconds.
     */
    public Map<String, Float> stages() {
        final Map<String, Float> ret = new LinkedHashMap<>();
        durations.forEach((k, v) -> ret.put(k, (float)(v * secondsPerNanosecond)));
        return ret;
    }

    public final float getSeconds() {
        return (float)((endTime - startTime) * secondsPerNanosecond);
    }

    private static String format(final long nanos) {
        return String.format("%.3f", nanos * secondsPerNanosecond);
    }

    @Override
    public final String toString() {
        return String.format("%.3f", getSeconds());
    }
}
