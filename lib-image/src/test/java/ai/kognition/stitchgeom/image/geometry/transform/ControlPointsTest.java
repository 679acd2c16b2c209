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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.opencv.core.Point;

import ai.kognition.stitchgeom.image.ShapeMismatchException;

public class ControlPointsTest {

    @Test
    public void testPairsArePositionAligned() {
        final Point[] src = {new Point(0, 0),new Point(1, 2)};
        final Point[] dst = {new Point(5, 5),new Point(6, 7)};

        final ControlPoints cps = ControlPoints.of(src, dst);
        assertEquals(2, cps.size());
        assertEquals(new Point(1, 2), cps.controlPoints[1].originalPoint);
        assertEquals(new Point(6, 7), cps.controlPoints[1].transformedPoint);
        assertArrayEquals(src, cps.sources());
        assertArrayEquals(dst, cps.destinations());
    }

    @Test
    public void testPointsAreCopied() {
        final Point src = new Point(1, 1);
        final ControlPoints cps = new ControlPoints(new ControlPoint(src, new Point(2, 2)));
        src.x = 100;
        cps.sources()[0].x = 200;

        assertEquals(1.0, cps.controlPoints[0].originalPoint.x, 0.0);
        assertEquals(1.0, cps.sources()[0].x, 0.0);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testLengthMismatch() {
        ControlPoints.of(new Point[] {new Point(0, 0)}, new Point[0]);
    }

    @Test(expected = NullPointerException.class)
    public void testNullControlPoint() {
        new ControlPoints(new ControlPoint(0, 0, 1, 1), null);
    }
}
