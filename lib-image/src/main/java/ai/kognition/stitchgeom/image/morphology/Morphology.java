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

package ai.kognition.stitchgeom.image.morphology;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import ai.kognition.stitchgeom.image.CvMat;

/**
 * Grey-scale <a href="https://docs.opencv.org/4.9.0/d4/d86/group__imgproc__filter.html#ga4ff0f3318642c4f469d0e11f242f3b6c">dilation</a>
 * and <a href="https://docs.opencv.org/4.9.0/d4/d86/group__imgproc__filter.html#gaeb1e0c1033e3f6b891a25d0511362aeb">erosion</a>.
 * Every cell of the result holds the maximum (dilation) or minimum (erosion) of the source over the
 * {@link Neighborhood} centered on it.
 * <p>
 * Cells outside the image take the value of the nearest edge cell ({@link Core#BORDER_REPLICATE}). This
 * means a window hanging off the edge sees exactly the in-bounds cells it covers.
 * <p>
 * The source is never modified.
 */
public class Morphology {
    public static final int BORDER_TYPE = Core.BORDER_REPLICATE;

    private static final Point CENTER = new Point(-1, -1);

    static {
        CvMat.initOpenCv();
    }

    private final Neighborhood neighborhood;

    public Morphology(final Neighborhood neighborhood) {
        if(neighborhood == null)
            throw new NullPointerException("Cannot pass a null neighborhood to " + Morphology.class.getSimpleName());
        this.neighborhood = neighborhood;
    }

    public Neighborhood neighborhood() {
        return neighborhood;
    }

    /**
     * @return the neighborhood maximum of {@code src}. <b>Note: The caller owns the CvMat returned</b>
     */
    public CvMat dilate(final Mat src) {
        try(final CvMat kernel = neighborhood.kernel();
            final CvMat ret = new CvMat();) {
            Imgproc.dilate(src, ret, kernel, CENTER, 1, BORDER_TYPE);
            return ret.returnMe();
        }
    }

    /**
     * @return the neighborhood minimum of {@code src}. <b>Note: The caller owns the CvMat returned</b>
     */
    public CvMat erode(final Mat src) {
        try(final CvMat kernel = neighborhood.kernel();
            final CvMat ret = new CvMat();) {
            Imgproc.erode(src, ret, kernel, CENTER, 1, BORDER_TYPE);
            return ret.returnMe();
        }
    }
}
