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

package ai.kognition.stitchgeom.image.geometry;

/**
 * A point addressed by row and column. {@link #x()} is the column and {@link #y()} is the row, which
 * is the convention OpenCV uses for {@link org.opencv.core.Point}.
 */
public interface Point {

    public static Point ocv(final org.opencv.core.Point ocvPoint) {
        return new Point() {
            @Override
            public double getRow() {
                return ocvPoint.y;
            }

            @Override
            public double getCol() {
                return ocvPoint.x;
            }

            @Override
            public String toString() {
                return Point.toString(this);
            }
        };
    }

    public static String toString(final Point p) {
        return p.getClass().getSimpleName() + "[ x=" + p.x() + ", y=" + p.y() + " ]";
    }

    public double getRow();

    public double getCol();

    default public double x() {
        return getCol();
    }

    default public double y() {
        return getRow();
    }

    /**
     * This will return a point that's translated such that if the point passed in
     * is the same as {@code this} then the result will be the [0, 0].
     *
     * It basically results in [ this - toOrigin ];
     */
    default public Point subtract(final Point toOrigin) {
        return new SimplePoint(y() - toOrigin.y(), x() - toOrigin.x());
    }

    default public double magnitudeSquared() {
        final double y = y();
        final double x = x();
        return (y * y) + (x * x);
    }

    default public double magnitude() {
        return Math.sqrt(magnitudeSquared());
    }

    default public double distance(final Point other) {
        final Point trans = subtract(other);
        return trans.magnitude();
    }
}
