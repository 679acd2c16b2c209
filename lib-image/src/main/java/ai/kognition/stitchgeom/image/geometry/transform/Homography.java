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

import org.opencv.core.CvType;
import org.opencv.core.Point;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.DegenerateGeometryException;
import ai.kognition.stitchgeom.image.ShapeMismatchException;

/**
 * <p>
 * A planar projective transform: a 3x3 matrix {@code H} such that a point {@code (x, y)} maps to
 * {@code (x'/w', y'/w')} where {@code (x', y', w') = H (x, y, 1)}.
 * </p>
 *
 * <p>
 * A homography is only defined up to a non-zero scale. Instances aren't normalized in any way; in
 * particular the bottom-right entry is whatever produced it. Use {@link #normalized()} when a fixed
 * scale is needed and {@link #isProportionalTo(Homography, double)} to compare two of them.
 * </p>
 *
 * Instances are immutable. Every accessor returns a copy.
 */
public final class Homography implements Transform2D {
    private final double[] h;

    /**
     * @throws ShapeMismatchException if {@code matrix} isn't 3x3.
     * @throws DegenerateGeometryException if any entry isn't finite or they're all zero.
     */
    public Homography(final double[][] matrix) {
        this(flatten(matrix));
    }

    private Homography(final double[] rowMajor) {
        boolean allZero = true;
        for(final double v: rowMajor) {
            if(!Double.isFinite(v))
                throw new DegenerateGeometryException("A homography must have finite entries: " + Arrays.toString(rowMajor));
            if(v != 0.0)
                allZero = false;
        }
        if(allZero)
            throw new DegenerateGeometryException("A homography can't be all zeros");
        this.h = rowMajor;
    }

    /**
     * @param rowMajor the 9 entries {@code h00, h01, h02, h10, ... h22}.
     */
    public static Homography fromRowMajor(final double[] rowMajor) {
        if(rowMajor == null)
            throw new NullPointerException("Cannot create a " + Homography.class.getSimpleName() + " from a null array");
        if(rowMajor.length != 9)
            throw new ShapeMismatchException("A homography has 9 entries. " + rowMajor.length + " were supplied");
        return new Homography(rowMajor.clone());
    }

    public static Homography identity() {
        return new Homography(new double[] {1,0,0,0,1,0,0,0,1});
    }

    private static double[] flatten(final double[][] matrix) {
        if(matrix == null)
            throw new NullPointerException("Cannot create a " + Homography.class.getSimpleName() + " from a null matrix");
        if(matrix.length != 3 || Arrays.stream(matrix).anyMatch(row -> row == null || row.length != 3))
            throw new ShapeMismatchException("A homography must be 3x3 but the matrix supplied was " + Arrays.deepToString(matrix));
        final double[] ret = new double[9];
        for(int r = 0; r < 3; r++)
            System.arraycopy(matrix[r], 0, ret, r * 3, 3);
        return ret;
    }

    public double get(final int row, final int col) {
        if(row < 0 || row > 2 || col < 0 || col > 2)
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") is outside of a 3x3 matrix");
        return h[(row * 3) + col];
    }

    public double[][] toArray() {
        return new double[][] {
            {h[0],h[1],h[2]},
            {h[3],h[4],h[5]},
            {h[6],h[7],h[8]}
        };
    }

    public double[] toRowMajor() {
        return h.clone();
    }

    /**
     * @return the matrix as a 3x3 {@code CV_64FC1} suitable for {@code Imgproc.warpPerspective}. <b>Note: The caller
     *         owns the CvMat returned</b>
     */
    public CvMat toMat() {
        try(final CvMat ret = new CvMat(3, 3, CvType.CV_64FC1);) {
            ret.put(0, 0, h);
            return ret.returnMe();
        }
    }

    /**
     * Project a single point.
     *
     * @throws DegenerateGeometryException if the point maps to infinity ({@code w' == 0}).
     */
    @Override
    public Point transform(final Point point) {
        final double x = point.x;
        final double y = point.y;

        final double w = (h[6] * x) + (h[7] * y) + h[8];
        if(w == 0.0)
            throw new DegenerateGeometryException("The point " + point + " maps to infinity under " + this);

        final double xp = ((h[0] * x) + (h[1] * y) + h[2]) / w;
        final double yp = ((h[3] * x) + (h[4] * y) + h[5]) / w;
        if(!Double.isFinite(xp) || !Double.isFinite(yp))
            throw new DegenerateGeometryException("The point " + point + " doesn't project to a finite point under " + this + " (w=" + w + ")");

        return new Point(xp, yp);
    }

    /**
     * @return the same transform scaled so the bottom-right entry is 1.
     * @throws DegenerateGeometryException if the bottom-right entry is 0.
     */
    public Homography normalized() {
        final double scale = h[8];
        if(scale == 0.0)
            throw new DegenerateGeometryException("Cannot normalize " + this + " since its bottom-right entry is zero");
        final double[] ret = new double[9];
        for(int i = 0; i < 9; i++)
            ret[i] = h[i] / scale;
        return new Homography(ret);
    }

    public double determinant() {
        return (h[0] * ((h[4] * h[8]) - (h[5] * h[7])))
            - (h[1] * ((h[3] * h[8]) - (h[5] * h[6])))
            + (h[2] * ((h[3] * h[7]) - (h[4] * h[6])));
    }

    /**
     * @return the transform mapping destination coordinates back to source coordinates.
     * @throws DegenerateGeometryException if the matrix is singular.
     */
    public Homography inverse() {
        final double det = determinant();
        if(det == 0.0 || !Double.isFinite(det))
            throw new DegenerateGeometryException("Cannot invert " + this + " since it's singular");

        // adjugate / determinant
        final double[] ret = {
            ((h[4] * h[8]) - (h[5] * h[7])) / det,
            ((h[2] * h[7]) - (h[1] * h[8])) / det,
            ((h[1] * h[5]) - (h[2] * h[4])) / det,
            ((h[5] * h[6]) - (h[3] * h[8])) / det,
            ((h[0] * h[8]) - (h[2] * h[6])) / det,
            ((h[2] * h[3]) - (h[0] * h[5])) / det,
            ((h[3] * h[7]) - (h[4] * h[6])) / det,
            ((h[1] * h[6]) - (h[0] * h[7])) / det,
            ((h[0] * h[4]) - (h[1] * h[3])) / det
        };
        return new Homography(ret);
    }

    /**
     * Compare two homographies ignoring scale (including sign). Both are scaled to unit Frobenius norm
     * and the largest difference between corresponding entries must not exceed {@code tolerance}.
     */
    public boolean isProportionalTo(final Homography other, final double tolerance) {
        final double[] a = unitNorm(h);
        final double[] b = unitNorm(other.h);

        double dot = 0.0;
        for(int i = 0; i < 9; i++)
            dot += a[i] * b[i];
        final double sign = dot < 0.0 ? -1.0 : 1.0;

        for(int i = 0; i < 9; i++) {
            if(Math.abs(a[i] - (sign * b[i])) > tolerance)
                return false;
        }
        return true;
    }

    private static double[] unitNorm(final double[] m) {
        double sumSq = 0.0;
        for(final double v: m)
            sumSq += v * v;
        final double norm = Math.sqrt(sumSq);
        final double[] ret = new double[m.length];
        for(int i = 0; i < m.length; i++)
            ret[i] = m[i] / norm;
        return ret;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(h);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        return Arrays.equals(h, ((Homography)obj).h);
    }

    @Override
    public String toString() {
        return "Homography " + Arrays.deepToString(toArray());
    }
}
