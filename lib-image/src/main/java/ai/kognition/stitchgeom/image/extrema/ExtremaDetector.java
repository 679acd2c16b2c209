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

package ai.kognition.stitchgeom.image.extrema;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.GeometryConfig;
import ai.kognition.stitchgeom.image.Utils;
import ai.kognition.stitchgeom.image.morphology.Morphology;
import ai.kognition.stitchgeom.image.morphology.Neighborhood;

/**
 * <p>
 * Marks the local maxima of a scalar response map using two morphological passes rather than a per-pixel
 * scan. A sample is marked when it's both
 * </p>
 * <ul>
 * <li>at least as large as every sample in its {@link Neighborhood} ({@code field >= dilate(field)}), and</li>
 * <li>strictly larger than the smallest sample in its neighborhood ({@code field > erode(field)}).</li>
 * </ul>
 * <p>
 * The second condition drops every sample whose whole neighborhood is one constant value. So a flat
 * plateau isn't reported, although the ring of plateau cells bordering lower values is. This isn't the
 * connected-component definition of a regional maximum where a plateau is reported as one maximum.
 * </p>
 * <p>
 * Border handling is whatever {@link Morphology} does (replicated edges). Instances are immutable and
 * may be shared between threads.
 * </p>
 */
public class ExtremaDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExtremaDetector.class);

    private final Morphology morphology;

    /**
     * A detector using a square neighborhood of the configured size (3x3 unless overridden, see
     * {@link GeometryConfig}).
     */
    public ExtremaDetector() {
        this(Neighborhood.square(GeometryConfig.load().neighborhoodSize()));
    }

    public ExtremaDetector(final Neighborhood neighborhood) {
        this.morphology = new Morphology(neighborhood);
    }

    public Neighborhood neighborhood() {
        return morphology.neighborhood();
    }

    /**
     * @throws ai.kognition.stitchgeom.image.ShapeMismatchException if the field is empty or ragged.
     */
    public MaxMask detect(final double[][] field) {
        try(final CvMat asMat = Utils.toMat(field);
            final CvMat mask = detectMat(asMat);) {
            return new MaxMask(Utils.toBooleanGrid(mask));
        }
    }

    /**
     * @param field a single channel image of any depth. It's not modified.
     * @throws ai.kognition.stitchgeom.image.ShapeMismatchException if the field is empty or has more than one channel.
     */
    public MaxMask detect(final Mat field) {
        try(final CvMat mask = detectMat(field);) {
            return new MaxMask(Utils.toBooleanGrid(mask));
        }
    }

    /**
     * The same as {@link #detect(Mat)} but leaves the result as a {@code CV_8UC1} mat of 0s and 1s.
     *
     * @return <b>Note: The caller owns the CvMat returned</b>
     */
    public CvMat detectMat(final Mat field) {
        try(final CvMat samples = Utils.asDoubleField(field);
            final CvMat dilated = morphology.dilate(samples);
            final CvMat eroded = morphology.erode(samples);
            final CvMat upper = new CvMat();
            final CvMat lower = new CvMat();
            final CvMat both = new CvMat();
            final CvMat ret = new CvMat();) {

            Core.compare(samples, dilated, upper, Core.CMP_GE);
            Core.compare(samples, eroded, lower, Core.CMP_GT);
            Core.bitwise_and(upper, lower, both);

            // compare yields 255 for true
            both.convertTo(ret, CvType.CV_8U, 1.0 / 255.0);

            if(LOGGER.isTraceEnabled())
                LOGGER.trace("Found {} maxima in a {}x{} field using {}", Core.countNonZero(ret), ret.rows(), ret.cols(), morphology.neighborhood());
            return ret.returnMe();
        }
    }
}
