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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.ShapeMismatchException;
import ai.kognition.stitchgeom.image.Utils;
import ai.kognition.stitchgeom.image.geometry.SimplePoint;

/**
 * The result of {@link ExtremaDetector#detect}. Same shape as the field it was computed from; a cell is
 * {@code true} when that sample is a local maximum. Immutable.
 */
public final class MaxMask {
    private final boolean[][] mask;
    private final int rows;
    private final int cols;

    MaxMask(final boolean[][] mask) {
        this.mask = mask;
        this.rows = mask.length;
        this.cols = rows == 0 ? 0 : mask[0].length;
    }

    /**
     * @throws ShapeMismatchException if the grid is empty, ragged or has a null row.
     */
    public static MaxMask of(final boolean[][] mask) {
        if(mask == null)
            throw new NullPointerException("Cannot create a " + MaxMask.class.getSimpleName() + " from a null grid");
        if(mask.length == 0 || mask[0] == null || mask[0].length == 0)
            throw new ShapeMismatchException("A " + MaxMask.class.getSimpleName() + " must have at least one row and one column");
        final int cols = mask[0].length;
        for(int r = 1; r < mask.length; r++) {
            if(mask[r] == null || mask[r].length != cols)
                throw new ShapeMismatchException(
                    "The grid isn't rectangular. Row 0 has " + cols + " columns but row " + r + " has " + (mask[r] == null ? 0 : mask[r].length));
        }
        final boolean[][] copy = new boolean[mask.length][];
        for(int r = 0; r < mask.length; r++)
            copy[r] = mask[r].clone();
        return new MaxMask(copy);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean get(final int row, final int col) {
        return mask[row][col];
    }

    public int count() {
        int ret = 0;
        for(final boolean[] row: mask)
            for(final boolean b: row)
                if(b) ret++;
        return ret;
    }

    /**
     * @return a copy of the mask.
     */
    public boolean[][] toArray() {
        final boolean[][] ret = new boolean[rows][];
        for(int r = 0; r < rows; r++)
            ret[r] = mask[r].clone();
        return ret;
    }

    /**
     * @return the marked cells in row-major order. These are the keypoint candidates.
     */
    public List<SimplePoint> locations() {
        final List<SimplePoint> ret = new ArrayList<>();
        for(int r = 0; r < rows; r++)
            for(int c = 0; c < cols; c++)
                if(mask[r][c]) ret.add(new SimplePoint(r, c));
        return Collections.unmodifiableList(ret);
    }

    /**
     * @return a {@code CV_8UC1} mat holding 1 at the maxima and 0 elsewhere. <b>Note: The caller owns the CvMat
     *         returned</b>
     */
    public CvMat toMat() {
        return Utils.toMat(mask);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(mask);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        return Arrays.deepEquals(mask, ((MaxMask)obj).mask);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("MaxMask [").append(rows).append('x').append(cols).append(']');
        for(final boolean[] row: mask) {
            sb.append(System.lineSeparator());
            for(final boolean b: row)
                sb.append(b ? '1' : '0');
        }
        return sb.toString();
    }
}
