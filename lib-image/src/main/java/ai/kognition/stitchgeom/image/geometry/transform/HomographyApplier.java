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

import java.util.ArrayList;
import java.util.List;

import org.opencv.core.Point;

import ai.kognition.stitchgeom.image.DegenerateGeometryException;
import ai.kognition.stitchgeom.image.ShapeMismatchException;

/**
 * Pushes points through a {@link Homography} and measures how well it explains a set of correspondences.
 * Nothing here modifies its arguments.
 */
public final class HomographyApplier {

    private HomographyApplier() {}

    /**
     * @return the projection of each point, in the same order.
     * @throws DegenerateGeometryException if any point maps to infinity.
     */
    public static Point[] apply(final Homography homography, final Point[] points) {
        if(homography == null || points == null)
            throw new NullPointerException("Cannot apply a null homography or apply one to null points. homography: " + homography);

        final Point[] ret = new Point[points.length];
        for(int i = 0; i < points.length; i++)
            ret[i] = homography.transform(points[i]);
        return ret;
    }

    public static List<Point> apply(final Homography homography, final List<Point> points) {
        if(homography == null || points == null)
            throw new NullPointerException("Cannot apply a null homography or apply one to null points. homography: " + homography);

        final List<Point> ret = new ArrayList<>(points.size());
        for(final Point p: points)
            ret.add(homography.transform(p));
        return ret;
    }

    /**
     * @return for each correspondence, the distance between the projected source point and the destination point.
     * @throws ShapeMismatchException if the point sets differ in length.
     * @throws DegenerateGeometryException if any source point maps to infinity.
     */
    public static double[] reprojectionErrors(final Homography homography, final Point[] source, final Point[] destination) {
        if(source == null || destination == null)
            throw new NullPointerException("Cannot measure reprojection error of a null point set");
        if(source.length != destination.length)
            throw new ShapeMismatchException("There are " + source.length + " source points but " + destination.length
                + " destination points. Correspondences must be position aligned.");

        final Point[] projected = apply(homography, source);
        final double[] ret = new double[projected.length];
        for(int i = 0; i < projected.length; i++)
            ret[i] = ai.kognition.stitchgeom.image.geometry.Point.ocv(projected[i])
                .distance(ai.kognition.stitchgeom.image.geometry.Point.ocv(destination[i]));
        return ret;
    }

    public static double[] reprojectionErrors(final Homography homography, final ControlPoints correspondences) {
        return reprojectionErrors(homography, correspondences.sources(), correspondences.destinations());
    }

    /**
     * @return the root mean square of the {@link #reprojectionErrors(Homography, Point[], Point[])}, 0 for no points.
     */
    public static double rmsReprojectionError(final Homography homography, final Point[] source, final Point[] destination) {
        final double[] errors = reprojectionErrors(homography, source, destination);
        if(errors.length == 0)
            return 0.0;
        double sumSq = 0.0;
        for(final double e: errors)
            sumSq += e * e;
        return Math.sqrt(sumSq / errors.length);
    }
}
