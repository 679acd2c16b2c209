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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Point;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.DegenerateGeometryException;
import ai.kognition.stitchgeom.image.ShapeMismatchException;
import ai.kognition.stitchgeom.image.Utils;

public class HomographyTest {
    private static final double EPSILON = 1e-9;

    private static final double[][] M = {
        {0.9,-0.2,30},
        {0.1,1.05,-12},
        {0.0004,0.0002,2}
    };

    @Test
    public void testAccessorsReturnCopies() {
        final Homography h = new Homography(M);
        final double[][] copy = h.toArray();
        copy[0][0] = 100;
        assertEquals(0.9, h.get(0, 0), 0.0);

        final double[] rowMajor = h.toRowMajor();
        rowMajor[8] = 100;
        assertEquals(2.0, h.get(2, 2), 0.0);
    }

    @Test
    public void testNormalized() {
        final Homography n = new Homography(M).normalized();
        assertEquals(1.0, n.get(2, 2), 0.0);
        assertEquals(15.0, n.get(0, 2), EPSILON);
        assertTrue(n.isProportionalTo(new Homography(M), EPSILON));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testCannotNormalizeWithZeroCorner() {
        new Homography(new double[][] {{1,0,0},{0,1,0},{1,0,0}}).normalized();
    }

    @Test
    public void testInverseRoundTrip() {
        final Homography h = new Homography(M);
        final Transform2D roundTrip = h.andThen(h.inverse());

        for(final Point p: new Point[] {new Point(0, 0),new Point(100, 50),new Point(-20, 300)}) {
            final Point back = roundTrip.transform(p);
            assertEquals(p.x, back.x, 1e-8);
            assertEquals(p.y, back.y, 1e-8);
        }
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testSingularCannotBeInverted() {
        new Homography(new double[][] {{1,2,3},{2,4,6},{0,0,1}}).inverse();
    }

    @Test
    public void testProportional() {
        final Homography h = new Homography(M);
        final double[][] negated = new double[3][3];
        for(int r = 0; r < 3; r++)
            for(int c = 0; c < 3; c++)
                negated[r][c] = -3.5 * M[r][c];

        assertTrue(h.isProportionalTo(new Homography(negated), EPSILON));
        assertFalse(h.isProportionalTo(Homography.identity(), EPSILON));
        assertNotEquals(h, new Homography(negated));
        assertEquals(h, new Homography(M));
        assertEquals(h.hashCode(), new Homography(M).hashCode());
    }

    @Test
    public void testToMat() {
        try(final CvMat mat = new Homography(M).toMat();) {
            assertEquals(CvType.CV_64FC1, mat.type());
            assertEquals(3, mat.rows());
            assertEquals(3, mat.cols());
            final double[][] back = Utils.to2dDoubleArray(mat);
            for(int r = 0; r < 3; r++)
                for(int c = 0; c < 3; c++)
                    assertEquals(M[r][c], back[r][c], 0.0);
        }
    }

    @Test(expected = ShapeMismatchException.class)
    public void testMustBe3x3() {
        new Homography(new double[][] {{1,0},{0,1}});
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRowMajorMustHave9Entries() {
        Homography.fromRowMajor(new double[8]);
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testAllZerosIsNotAHomography() {
        new Homography(new double[3][3]);
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testEntriesMustBeFinite() {
        new Homography(new double[][] {{1,0,0},{0,Double.POSITIVE_INFINITY,0},{0,0,1}});
    }
}
