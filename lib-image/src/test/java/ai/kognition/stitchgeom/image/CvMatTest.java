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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

public class CvMatTest {

    @Test
    public void testZeros() {
        try(final CvMat zeros = CvMat.zeros(3, 4, CvType.CV_64FC1);) {
            assertEquals(3, zeros.rows());
            assertEquals(4, zeros.cols());
            assertEquals(0.0, zeros.get(2, 3)[0], 0.0);
        }
    }

    @Test
    public void testMoveTakesTheData() {
        final Mat mat = Mat.ones(2, 2, CvType.CV_64FC1);
        try(final CvMat moved = CvMat.move(mat);) {
            assertTrue(mat.empty());
            assertEquals(2, moved.rows());
            assertEquals(1.0, moved.get(1, 1)[0], 0.0);
        }
    }

    @Test
    public void testMoveNull() {
        assertNull(CvMat.move(null));
    }

    @Test
    public void testReturnMeSkipsOneClose() {
        final CvMat outer;
        try(final CvMat inner = new CvMat(2, 2, CvType.CV_8UC1);) {
            outer = inner.returnMe();
        }
        assertFalse(outer.isClosed());
        assertEquals(2, outer.rows());

        outer.close();
        assertTrue(outer.isClosed());
        assertTrue(outer.empty());

        // a second close is harmless
        outer.close();
    }
}
