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

import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.InvalidNeighborhoodException;

/**
 * The window over which a local maximum or minimum is taken. Both extents must be positive and odd so
 * the window has a center cell, which is the cell the result is written to. The default is the 3x3
 * rectangle, that is, the 8-connected neighbors.
 */
public final class Neighborhood {

    /**
     * Shapes map directly onto OpenCV's
     * <a href="https://docs.opencv.org/4.9.0/d4/d86/group__imgproc__filter.html#gac2db39b56866583a95a5680313c314ad">MorphShapes</a>.
     */
    public enum Shape {
        RECT(Imgproc.MORPH_RECT),
        CROSS(Imgproc.MORPH_CROSS),
        ELLIPSE(Imgproc.MORPH_ELLIPSE);

        private final int value;

        private Shape(final int value) {
            this.value = value;
        }
    }

    public static final Neighborhood DEFAULT = square(3);

    private final int width;
    private final int height;
    private final Shape shape;

    public Neighborhood(final int width, final int height, final Shape shape) {
        if(shape == null)
            throw new NullPointerException("Cannot pass a null shape to a " + Neighborhood.class.getSimpleName());
        check("width", width);
        check("height", height);
        this.width = width;
        this.height = height;
        this.shape = shape;
    }

    public static Neighborhood square(final int size) {
        return new Neighborhood(size, size, Shape.RECT);
    }

    public static Neighborhood rect(final int width, final int height) {
        return new Neighborhood(width, height, Shape.RECT);
    }

    private static void check(final String what, final int extent) {
        if(extent <= 0)
            throw new InvalidNeighborhoodException("A neighborhood " + what + " must be positive. It was " + extent);
        if((extent & 0x01) == 0)
            throw new InvalidNeighborhoodException("A neighborhood " + what + " must be odd so that there's a center cell. It was " + extent);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public Shape shape() {
        return shape;
    }

    /**
     * @return the structuring element for this neighborhood anchored at its center. <b>Note: The caller owns the CvMat
     *         returned</b>
     */
    public CvMat kernel() {
        CvMat.initOpenCv();
        return CvMat.move(Imgproc.getStructuringElement(shape.value, new Size(width, height)));
    }

    @Override
    public int hashCode() {
        return (31 * ((31 * width) + height)) + shape.hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final Neighborhood other = (Neighborhood)obj;
        return width == other.width && height == other.height && shape == other.shape;
    }

    @Override
    public String toString() {
        return "Neighborhood [" + width + "x" + height + " " + shape + "]";
    }
}
