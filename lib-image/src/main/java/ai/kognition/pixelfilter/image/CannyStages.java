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

package ai.kognition.pixelfilter.image;

import java.util.Collections;
import java.util.Map;

/**
 * Everything a {@link CannyPipeline} run produced, stage by stage.
 */
public final class CannyStages {
    public final GreyscaleImage greyscale;
    /**
     * The blurred greyscale image that the gradient was calculated from, or null if blurring was off.
     */
    public final GreyscaleImage blurred;
    public final GradientField gradient;
    public final EdgeMap suppressed;
    public final Thresholds thresholds;
    public final EdgeMap thresholded;
    /**
     * The final 0/255 edge map.
     */
    public final EdgeMap edges;
    /**
     * How long each stage took, in seconds, in the order they ran.
     */
    public final Map<String, Float> stageSeconds;

    CannyStages(final GreyscaleImage greyscale, final GreyscaleImage blurred, final GradientField gradient, final EdgeMap suppressed,
        final Thresholds thresholds, final EdgeMap thresholded, final EdgeMap edges, final Map<String, Float> stageSeconds) {
        this.greyscale = greyscale;
        this.blurred = blurred;
        this.gradient = gradient;
        this.suppressed = suppressed;
        this.thresholds = thresholds;
        this.thresholded = thresholded;
        this.edges = edges;
        this.stageSeconds = Collections.unmodifiableMap(stageSeconds);
    }
}
