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

import org.opencv.core.Point;

/**
 * One correspondence: where a feature sits in the source image ({@code originalPoint}) and where the
 * matched feature sits in the destination image ({@code transformedPoint}).
 */
public class ControlPoint {
    public final Point originalPoint;
    public final Point transformedPoint;

    public ControlPoint(final Point originalPoint, final Point transformedPoint) {
        if(originalPoint == null || transformedPoint == null)
            throw new NullPointerException("Cannot create a " + ControlPoint.class.getSimpleName() + " with a null point. Original: " + originalPoint
                + ", transformed: " + transformedPoint);
        this.originalPoint = originalPoint.clone();
        this.transformedPoint = transformedPoint.clone();
    }

    public ControlPoint(final double srcX, final double srcY, final double dstX, final double dstY) {
        this(new Point(srcX, srcY), new Point(dstX, dstY));
    }

    @Override
    public String toString() {
        return "ControlPoint [originalPoint=" + originalPoint + ", transformedPoint=" + transformedPoint + "]";
    }
}
