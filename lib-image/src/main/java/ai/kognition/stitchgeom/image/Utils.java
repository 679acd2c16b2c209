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

package ai.kognition.stitchgeom.image;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Conversions between plain java arrays and {@link Mat}s, and the shape checks applied to
 * response fields before any native call is made.
 */
public class Utils {

    static {
        ImageAPI._init();
    }

    /**
     * Copy a rectangular {@code double[][]} into a new {@code CV_64FC1} {@link CvMat}.
     *
     * @throws ShapeMismatchException if {@code a} is empty or ragged.
     * @return <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat toMat(final double[][] a) {
        checkRectangular(a);
        final int rows = a.length;
        final int cols = a[0].length;

        final double[] flat = new double[rows * cols];
        for(int r = 0; r < rows; r++)
            System.arraycopy(a[r], 0, flat, r * cols, cols);

        try(final CvMat ret = new CvMat(rows, cols, CvType.CV_64FC1);) {
            ret.put(0, 0, flat);
            return ret.returnMe();
        }
    }

    public static double[][] to2dDoubleArray(final Mat mat) {
        final int r = mat.rows();
        final int c = mat.cols();
        final double[][] ret = new double[r][c];
        if(r == 0 || c == 0)
            return ret;

        if(mat.type() == CvType.CV_64FC1 && mat.isContinuous()) {
            final double[] flat = new double[r * c];
            mat.get(0, 0, flat);
            for(int i = 0; i < r; i++)
                System.arraycopy(flat, i * c, ret[i], 0, c);
        } else {
            for(int i = 0; i < r; i++)
                for(int j = 0; j < c; j++)
                    ret[i][j] = mat.get(i, j)[0];
        }
        return ret;
    }

    /**
     * Interpret a single channel mask as booleans where any non-zero value is {@code true}.
     */
    public static boolean[][] toBooleanGrid(final Mat mask) {
        if(mask.channels() != 1)
            throw new ShapeMismatchException("A mask must have a single channel. The one passed has " + mask.channels());

        final int rows = mask.rows();
        final int cols = mask.cols();
        final boolean[][] ret = new boolean[rows][cols];
        if(rows == 0 || cols == 0)
            return ret;

        if(mask.type() == CvType.CV_8UC1 && mask.isContinuous()) {
            final byte[] flat = new byte[rows * cols];
            mask.get(0, 0, flat);
            for(int r = 0; r < rows; r++)
                for(int c = 0; c < cols; c++)
                    ret[r][c] = flat[(r * cols) + c] != 0;
        } else {
            for(int r = 0; r < rows; r++)
                for(int c = 0; c < cols; c++)
                    ret[r][c] = mask.get(r, c)[0] != 0.0;
        }
        return ret;
    }

    /**
     * Copy a boolean grid into a {@code CV_8UC1} mat of 0s and 1s.
     *
     * @return <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat toMat(final boolean[][] grid) {
        final int rows = grid.length;
        final int cols = rows == 0 ? 0 : grid[0].length;
        final byte[] flat = new byte[rows * cols];
        for(int r = 0; r < rows; r++)
            for(int c = 0; c < cols; c++)
                flat[(r * cols) + c] = grid[r][c] ? (byte)1 : (byte)0;

        try(final CvMat ret = new CvMat(rows, cols, CvType.CV_8UC1);) {
            if(flat.length > 0)
                ret.put(0, 0, flat);
            return ret.returnMe();
        }
    }

    /**
     * Make a {@code CV_64FC1} copy of a scalar response field. The field passed in is never modified.
     *
     * @throws ShapeMismatchException if the field is null, empty or has more than one channel.
     * @return <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat asDoubleField(final Mat field) {
        if(field == null)
            throw new NullPointerException("Cannot pass a null field");
        if(field.empty() || field.rows() == 0 || field.cols() == 0)
            throw new ShapeMismatchException("The field must have at least one sample. It was " + field.rows() + "x" + field.cols());
        if(field.channels() != 1)
            throw new ShapeMismatchException("The field must be a single channel (scalar) image. It has " + field.channels() + " channels");

        try(final CvMat ret = new CvMat();) {
            field.convertTo(ret, CvType.CV_64F);
            return ret.returnMe();
        }
    }

    public static void checkRectangular(final double[][] a) {
        if(a == null)
            throw new NullPointerException("Cannot pass a null field");
        if(a.length == 0 || a[0] == null || a[0].length == 0)
            throw new ShapeMismatchException("The field must have at least one row and one column");
        final int cols = a[0].length;
        for(int r = 1; r < a.length; r++) {
            if(a[r] == null || a[r].length != cols)
                throw new ShapeMismatchException(
                    "The field isn't rectangular. Row 0 has " + cols + " columns but row " + r + " has " + (a[r] == null ? 0 : a[r].length));
        }
    }
}
