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

import org.opencv.core.Point;

import ai.kognition.stitchgeom.image.ShapeMismatchException;

/**
 * A set of correspondences between a source and a destination image. The source and destination point
 * sets are position aligned: {@code sources()[i]} corresponds to {@code destinations()[i]}.
 */
public class ControlPoints {
    public final ControlPoint[] controlPoints;

    public ControlPoints(final ControlPoint... controlPoints) {
        if(controlPoints == null)
            throw new NullPointerException("Cannot create " + ControlPoints.class.getSimpleName() + " from a null array");
        if(Arrays.stream(controlPoints).anyMatch(p -> p == null))
            throw new NullPointerException("Cannot create " + ControlPoints.class.getSimpleName() + " with any null controlPoints");
        this.controlPoints = controlPoints.clone();
    }

    /**
     * Pair up two position aligned point sets.
     *
     * @throws ShapeMismatchException if the two sets aren't the same length.
     */
    public static ControlPoints of(final Point[] sources, final Point[] destinations) {
        if(sources == null || destinations == null)
            throw new NullPointerException("Cannot pair null point sets. sources: " + Arrays.toString(sources) + ", destinations: "
                + Arrays.toString(destinations));
        if(sources.length != destinations.length)
            throw new ShapeMismatchException("There are " + sources.length + " source points but " + destinations.length
                + " destination points. Correspondences must be position aligned.");

        final ControlPoint[] cps = new ControlPoint[sources.length];
        for(int i = 0; i < cps.length; i++)
            cps[i] = new ControlPoint(sources[i], destinations[i]);
        return new ControlPoints(cps);
    }

    public int size() {
        return controlPoints.length;
    }

    public Point[] sources() {
        return Arrays.stream(controlPoints).map(cp -> cp.originalPoint.clone()).toArray(Point[]::new);
    }

    public Point[] destinations() {
        return Arrays.stream(controlPoints).map(cp -> cp.transformedPoint.clone()).toArray(Point[]::new);
    }

    @Override
    public String toString() {
        return "ControlPoints " + Arrays.toString(controlPoints);
    }
}
