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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pixelfilter.util.Settings;
import ai.kognition.pixelfilter.util.StageTimer;

/**
 * <p>
 * The Canny edge detector. The stages run strictly in order, each one fully materializing its output before the
 * next begins:
 * </p>
 *
 * <ol>
 * <li>greyscale ({@link GreyscaleConverter})</li>
 * <li>optional blur ({@link ConvolutionEngine}, {@link Kernel#GAUSSIAN_BLUR} by default)</li>
 * <li>gradient ({@link GradientOperator}), calculated from the blurred image when blurring is on and from the
 * greyscale image when it's off</li>
 * <li>non-maximum suppression ({@link NonMaxSuppressor})</li>
 * <li>threshold derivation from the median suppressed edge strength, unless fixed thresholds were given</li>
 * <li>hysteresis ({@link HysteresisThresholder})</li>
 * <li>binarization to 0/255</li>
 * </ol>
 *
 * <p>
 * An unsupported pixel format fails the whole run with an {@link UnsupportedPixelFormatException} before any stage
 * starts. Instances are immutable.
 * </p>
 */
public class CannyPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(CannyPipeline.class);

    public static final String SETTINGS_RESOURCE = "pixelfilter-defaults.properties";

    public static final String BLUR = "canny.blur";
    public static final String BLUR_KERNEL = "canny.blur.kernel";
    public static final String LOW_RATIO = "canny.threshold.low.ratio";
    public static final String HIGH_RATIO = "canny.threshold.high.ratio";

    private final boolean blur;
    private final Kernel blurKernel;
    private final double lowRatio;
    private final double highRatio;
    private final Thresholds fixedThresholds;

    private CannyPipeline(final Builder builder) {
        this.blur = builder.blur;
        this.blurKernel = builder.blurKernel;
        this.lowRatio = builder.lowRatio;
        this.highRatio = builder.highRatio;
        this.fixedThresholds = builder.thresholds;
    }

    /**
     * A pipeline configured from {@value #SETTINGS_RESOURCE} and any system property or environment overrides.
     */
    public static CannyPipeline defaults() {
        return fromSettings(Settings.load(SETTINGS_RESOURCE));
    }

    public static CannyPipeline fromSettings(final Settings settings) {
        return new Builder()
            .blur(settings.getBoolean(BLUR, true))
            .blurKernel(Kernel.named(settings.getString(BLUR_KERNEL, "GAUSSIAN_BLUR")))
            .thresholdRatios(settings.getDouble(LOW_RATIO, HysteresisThresholder.DEFAULT_LOW_RATIO),
                settings.getDouble(HIGH_RATIO, HysteresisThresholder.DEFAULT_HIGH_RATIO))
            .build();
    }

    public boolean isBlurring() {
        return blur;
    }

    public Kernel blurKernel() {
        return blurKernel;
    }

    public EdgeMap detect(final PixelBuffer buffer) {
        return run(buffer).edges;
    }

    /**
     * Detect the edges in an image. The image's pixels are acquired only for the greyscale stage.
     */
    public EdgeMap detect(final ImageSource image) {
        PixelFormat.requireSupported(image.pixelFormat());
        return run(GreyscaleConverter.toGrey(image)).edges;
    }

    public CannyStages run(final PixelBuffer buffer) {
        PixelFormat.requireSupported(buffer.format());
        LOGGER.debug("running canny on {}", buffer);

        final StageTimer timer = new StageTimer(LOGGER);
        timer.start();
        final GreyscaleImage grey = timer.time("greyscale", () -> GreyscaleConverter.toGrey(buffer));
        return run(grey, timer);
    }

    /**
     * Run the stages after the greyscale conversion on an image that's already grey.
     */
    public CannyStages run(final GreyscaleImage grey) {
        LOGGER.debug("running canny on {}", grey);
        final StageTimer timer = new StageTimer(LOGGER);
        timer.start();
        return run(grey, timer);
    }

    private CannyStages run(final GreyscaleImage grey, final StageTimer timer) {
        final GreyscaleImage blurred = blur ? timer.time("blur", () -> ConvolutionEngine.convolve(grey, blurKernel)) : null;
        final GreyscaleImage gradientSource = blurred == null ? grey : blurred;

        final GradientField gradient = timer.time("gradient", () -> GradientOperator.gradient(gradientSource));
        final EdgeMap suppressed = timer.time("suppression", () -> NonMaxSuppressor.suppress(gradient));
        final Thresholds thresholds = fixedThresholds != null ? fixedThresholds
            : timer.time("thresholds", () -> HysteresisThresholder.deriveThresholds(suppressed, lowRatio, highRatio));
        final EdgeMap thresholded = timer.time("hysteresis", () -> HysteresisThresholder.threshold(suppressed, thresholds));
        final EdgeMap edges = timer.time("binarize", () -> thresholded.binarize());

        timer.stop();
        LOGGER.debug("canny found {} edge pixels using {} in {} seconds", edges.countEdges(), thresholds, timer);
        return new CannyStages(grey, blurred, gradient, suppressed, thresholds, thresholded, edges, timer.stages());
    }

    @Override
    public String toString() {
        return "CannyPipeline [blur=" + blur + ", blurKernel=" + blurKernel + ", lowRatio=" + lowRatio + ", highRatio=" + highRatio
            + ", fixedThresholds=" + fixedThresholds + "]";
    }

    public static class Builder {
        private boolean blur = true;
        private Kernel blurKernel = Kernel.GAUSSIAN_BLUR;
        private double lowRatio = HysteresisThresholder.DEFAULT_LOW_RATIO;
        private double highRatio = HysteresisThresholder.DEFAULT_HIGH_RATIO;
        private Thresholds thresholds = null;

        public Builder blur(final boolean blur) {
            this.blur = blur;
            return this;
        }

        public Builder blurKernel(final Kernel blurKernel) {
            if(blurKernel == null)
                throw new NullPointerException("The blur kernel can't be null. Use blur(false) to skip blurring.");
            this.blurKernel = blurKernel;
            return this;
        }

        /**
         * The multipliers applied to the median suppressed edge strength to derive the low and high thresholds.
         */
        public Builder thresholdRatios(final double lowRatio, final double highRatio) {
            if(lowRatio < 0.0 || lowRatio > highRatio)
                throw new IllegalArgumentException("Threshold ratios must satisfy 0 <= low <= high (low=" + lowRatio + ", high=" + highRatio + ")");
            this.lowRatio = lowRatio;
            this.highRatio = highRatio;
            return this;
        }

        /**
         * Use fixed thresholds rather than deriving them from each image.
         */
        public Builder thresholds(final double low, final double high) {
            this.thresholds = new Thresholds(low, high);
            return this;
        }

        public CannyPipeline build() {
            return new CannyPipeline(this);
        }
    }
}
