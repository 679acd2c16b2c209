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

package ai.kognition.stitchgeom.image.geometry.transform;

import java.util.Arrays;
import java.util.List;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.DegenerateGeometryException;
import ai.kognition.stitchgeom.image.GeometryConfig;
import ai.kognition.stitchgeom.image.InsufficientCorrespondencesException;
import ai.kognition.stitchgeom.image.ShapeMismatchException;
import ai.kognition.stitchgeom.util.Timer;

/**
 * <p>
 * Estimates the {@link Homography} relating two sets of corresponding points using the Direct Linear
 * Transform. Each correspondence {@code (x, y) -> (u, v)} contributes two rows to a {@code 2N x 9}
 * matrix {@code A}
 * </p>
 *
 * <pre>
 * [ x, y, 1, 0, 0, 0, -u*x, -u*y, -u ]
 * [ 0, 0, 0, x, y, 1, -v*x, -v*y, -v ]
 * </pre>
 *
 * <p>
 * so that the 9 entries {@code h} of the homography (row-major) satisfy {@code A h = 0}. {@code h} is
 * taken as the right singular vector of {@code A} with the smallest singular value, which makes it the
 * minimizer of {@code |A h|^2} subject to {@code |h| = 1}. For exactly consistent data with 4
 * correspondences that's an exact solution.
 * </p>
 *
 * <p>
 * {@code A} is built from conditioned coordinates. Each point set is translated so its centroid is at the
 * origin and scaled so the mean distance from it is {@code sqrt(2)}. The degeneracy tests below are
 * therefore independent of where the points sit in the image. The solution is mapped back to the original coordinates and returned with unit Frobenius norm.
 * It's not normalized by its bottom-right entry.
 * </p>
 *
 * <p>
 * The estimate is rejected with a {@link DegenerateGeometryException} rather than returned when
 * </p>
 * <ul>
 * <li>the correspondences don't pin down a single solution (collinear or repeated points leave more than one
 * singular value of {@code A} near zero). That's when the second smallest singular value is no more than the
 * configured {@code homography.degeneracy-tolerance} times the largest.</li>
 * <li>the solution is itself singular, which happens when 3 source points are collinear but their
 * destinations aren't. That's when the smallest singular value of the conditioned homography is no more than
 * the tolerance times its largest.</li>
 * </ul>
 *
 * <p>
 * There's no outlier rejection. The correspondences are expected to have been filtered already.
 * Instances are immutable and may be shared between threads.
 * </p>
 */
public class HomographyEstimator {
    private static final Logger LOGGER = LoggerFactory.getLogger(HomographyEstimator.class);

    public static final int MIN_CORRESPONDENCES = 4;

    private static final int UNKNOWNS = 9;
    private static final double SQRT2 = Math.sqrt(2.0);

    static {
        CvMat.initOpenCv();
    }

    private final double degeneracyTolerance;

    public HomographyEstimator() {
        this(GeometryConfig.load());
    }

    public HomographyEstimator(final GeometryConfig config) {
        this(config.degeneracyTolerance());
    }

    public HomographyEstimator(final double degeneracyTolerance) {
        if(!(degeneracyTolerance >= 0.0) || Double.isInfinite(degeneracyTolerance))
            throw new IllegalArgumentException("The degeneracy tolerance must be a finite, non-negative number. It was " + degeneracyTolerance);
        this.degeneracyTolerance = degeneracyTolerance;
    }

    public double degeneracyTolerance() {
        return degeneracyTolerance;
    }

    public Homography estimate(final ControlPoints correspondences) {
        if(correspondences == null)
            throw new NullPointerException("Cannot estimate a homography from null correspondences");
        return estimate(correspondences.sources(), correspondences.destinations());
    }

    public Homography estimate(final List<Point> source, final List<Point> destination) {
        if(source == null || destination == null)
            throw new NullPointerException("Cannot estimate a homography from a null point set. source: " + source + ", destination: " + destination);
        return estimate(source.toArray(new Point[0]), destination.toArray(new Point[0]));
    }

    /**
     * @param source points in the source image.
     * @param destination the corresponding points in the destination image, position aligned with {@code source}.
     * @return the homography mapping {@code source} onto {@code destination}.
     * @throws ShapeMismatchException if the point sets differ in length.
     * @throws InsufficientCorrespondencesException if there are fewer than {@value #MIN_CORRESPONDENCES} correspondences.
     * @throws DegenerateGeometryException if the correspondences don't determine a unique, invertible homography.
     */
    public Homography estimate(final Point[] source, final Point[] destination) {
        checkCorrespondences(source, destination);

        final Timer timer = new Timer().start();
        final Solution solution = solve(source, destination);
        timer.stop();

        final double ratio = solution.conditionRatio();
        if(!(ratio > degeneracyTolerance)) {
            LOGGER.debug("Rejecting {} correspondences as degenerate. Singular values: {}", source.length, Arrays.toString(solution.singularValues));
            throw new DegenerateGeometryException("The " + source.length + " correspondences don't determine a unique homography. The ratio of the "
                + "second smallest to the largest singular value is " + ratio + " which is within the degeneracy tolerance of "
                + degeneracyTolerance + ". Are the points collinear or repeated?");
        }

        final double rank = solution.rankRatio();
        if(!(rank > degeneracyTolerance)) {
            LOGGER.debug("Rejecting a singular homography estimated from {} correspondences: {}", source.length, Arrays.toString(solution.h));
            throw new DegenerateGeometryException("The " + source.length + " correspondences only fit a singular homography. The ratio of its smallest "
                + "to its largest singular value is " + rank + " which is within the degeneracy tolerance of " + degeneracyTolerance
                + ". Are 3 of the source points collinear while their destinations aren't?");
        }

        final Homography ret = Homography.fromRowMajor(solution.h);
        LOGGER.debug("Estimated a homography from {} correspondences in {} seconds with a condition ratio of {}", source.length, timer, ratio);
        return ret;
    }

    /**
     * The ratio of the second smallest to the largest singular value of the DLT matrix built from the
     * conditioned correspondences. Values near zero mean the correspondences don't determine a unique
     * homography. This doesn't apply the degeneracy tolerance. It doesn't change when both point sets are
     * translated or uniformly scaled.
     *
     * @throws DegenerateGeometryException if all of the source or all of the destination points coincide.
     */
    public static double conditionRatio(final Point[] source, final Point[] destination) {
        checkCorrespondences(source, destination);
        return solve(source, destination).conditionRatio();
    }

    private static class Solution {
        // in the caller's coordinates, unit norm
        final double[] h;
        final double[] singularValues;
        final double[] conditionedSingularValues;

        Solution(final double[] h, final double[] singularValues, final double[] conditionedSingularValues) {
            this.h = h;
            this.singularValues = singularValues;
            this.conditionedSingularValues = conditionedSingularValues;
        }

        double conditionRatio() {
            return singularValues[UNKNOWNS - 2] / singularValues[0];
        }

        double rankRatio() {
            return conditionedSingularValues[2] / conditionedSingularValues[0];
        }
    }

    /**
     * The similarity taking a point set to one centered on the origin with a mean distance from it of
     * {@code sqrt(2)}.
     */
    private static class Conditioner {
        final double cx;
        final double cy;
        final double scale;

        Conditioner(final String which, final Point[] points) {
            double sx = 0.0;
            double sy = 0.0;
            for(final Point p: points) {
                sx += p.x;
                sy += p.y;
            }
            cx = sx / points.length;
            cy = sy / points.length;

            double dist = 0.0;
            for(final Point p: points)
                dist += Math.hypot(p.x - cx, p.y - cy);
            dist /= points.length;

            if(!(dist > 0.0) || !Double.isFinite(dist))
                throw new DegenerateGeometryException("All " + points.length + " " + which + " points are at the same location (" + cx + ", " + cy + ")");
            scale = SQRT2 / dist;
        }

        double x(final Point p) {
            return (p.x - cx) * scale;
        }

        double y(final Point p) {
            return (p.y - cy) * scale;
        }

        double[] forward() {
            return new double[] {
                scale,0.0,-scale * cx,
                0.0,scale,-scale * cy,
                0.0,0.0,1.0
            };
        }

        double[] inverse() {
            return new double[] {
                1.0 / scale,0.0,cx,
                0.0,1.0 / scale,cy,
                0.0,0.0,1.0
            };
        }
    }

    private static Solution solve(final Point[] source, final Point[] destination) {
        final Conditioner src = new Conditioner("source", source);
        final Conditioner dst = new Conditioner("destination", destination);

        final double[] conditioned = new double[UNKNOWNS];
        final double[] singularValues = new double[UNKNOWNS];
        final double[] conditionedSingularValues = new double[3];

        try(final CvMat a = designMatrix(source, destination, src, dst);
            final CvMat w = new CvMat();
            final CvMat u = new CvMat();
            final CvMat vt = new CvMat();) {

            // OpenCV sorts the singular values in descending order and returns V transposed so
            // the null space estimate is the last row of vt.
            Core.SVDecomp(a, w, u, vt);
            w.get(0, 0, singularValues);
            vt.get(UNKNOWNS - 1, 0, conditioned);
        }

        try(final CvMat hc = new CvMat(3, 3, CvType.CV_64FC1);
            final CvMat w = new CvMat();
            final CvMat u = new CvMat();
            final CvMat vt = new CvMat();) {
            hc.put(0, 0, conditioned);
            Core.SVDecomp(hc, w, u, vt);
            w.get(0, 0, conditionedSingularValues);
        }

        final double[] h = unitNorm(multiply(multiply(dst.inverse(), conditioned), src.forward()));

        if(LOGGER.isTraceEnabled())
            LOGGER.trace("DLT over {} correspondences. Singular values: {}", source.length, Arrays.toString(singularValues));
        return new Solution(h, singularValues, conditionedSingularValues);
    }

    // With 4 correspondences A is only 8x9 so it's padded with zero rows to 9x9. That leaves the null
    // space unchanged but gets the full 9x9 right singular basis from the decomposition.
    private static CvMat designMatrix(final Point[] source, final Point[] destination, final Conditioner src, final Conditioner dst) {
        final int n = source.length;
        final int rows = Math.max(2 * n, UNKNOWNS);
        final double[] flat = new double[rows * UNKNOWNS];

        for(int i = 0; i < n; i++) {
            final double x = src.x(source[i]);
            final double y = src.y(source[i]);
            final double u = dst.x(destination[i]);
            final double v = dst.y(destination[i]);

            final int r0 = (2 * i) * UNKNOWNS;
            flat[r0] = x;
            flat[r0 + 1] = y;
            flat[r0 + 2] = 1.0;
            flat[r0 + 6] = -u * x;
            flat[r0 + 7] = -u * y;
            flat[r0 + 8] = -u;

            final int r1 = r0 + UNKNOWNS;
            flat[r1 + 3] = x;
            flat[r1 + 4] = y;
            flat[r1 + 5] = 1.0;
            flat[r1 + 6] = -v * x;
            flat[r1 + 7] = -v * y;
            flat[r1 + 8] = -v;
        }

        try(final CvMat ret = new CvMat(rows, UNKNOWNS, CvType.CV_64FC1);) {
            ret.put(0, 0, flat);
            return ret.returnMe();
        }
    }

    // 3x3, row-major
    private static double[] multiply(final double[] l, final double[] r) {
        final double[] ret = new double[9];
        for(int row = 0; row < 3; row++)
            for(int col = 0; col < 3; col++) {
                double sum = 0.0;
                for(int k = 0; k < 3; k++)
                    sum += l[(row * 3) + k] * r[(k * 3) + col];
                ret[(row * 3) + col] = sum;
            }
        return ret;
    }

    private static double[] unitNorm(final double[] h) {
        double sumSq = 0.0;
        for(final double v: h)
            sumSq += v * v;
        final double norm = Math.sqrt(sumSq);
        for(int i = 0; i < h.length; i++)
            h[i] /= norm;
        return h;
    }

    private static void checkCorrespondences(final Point[] source, final Point[] destination) {
        if(source == null || destination == null)
            throw new NullPointerException("Cannot estimate a homography from a null point set. source: " + source + ", destination: " + destination);
        if(source.length != destination.length)
            throw new ShapeMismatchException("There are " + source.length + " source points but " + destination.length
                + " destination points. Correspondences must be position aligned.");
        if(source.length < MIN_CORRESPONDENCES)
            throw new InsufficientCorrespondencesException(MIN_CORRESPONDENCES, source.length);

        for(int i = 0; i < source.length; i++) {
            checkPoint("source", i, source[i]);
            checkPoint("destination", i, destination[i]);
        }
    }

    private static void checkPoint(final String which, final int index, final Point p) {
        if(p == null)
            throw new NullPointerException("The " + which + " point at index " + index + " is null");
        if(!Double.isFinite(p.x) || !Double.isFinite(p.y))
            throw new DegenerateGeometryException("The " + which + " point at index " + index + " isn't finite: " + p);
    }
}
