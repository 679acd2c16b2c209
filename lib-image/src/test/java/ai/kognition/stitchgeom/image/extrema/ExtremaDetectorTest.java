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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Scalar;

import ai.kognition.stitchgeom.image.CvMat;
import ai.kognition.stitchgeom.image.ShapeMismatchException;
import ai.kognition.stitchgeom.image.Utils;
import ai.kognition.stitchgeom.image.geometry.SimplePoint;
import ai.kognition.stitchgeom.image.morphology.Neighborhood;

public class ExtremaDetectorTest {

    // Two 3x3 plateaus (22 and 33) and a row of spikes 44, 45, 44 on a background of 10.
    private static final double[][] BLOCKS_AND_SPIKES = {
        {10,10,10,10,10,10,10,10,10,10},
        {10,22,22,22,10,10,10,10,10,10},
        {10,22,22,22,10,10,10,10,10,10},
        {10,22,22,22,10,10,10,10,10,10},
        {10,10,10,10,10,10,10,10,10,10},
        {10,10,10,10,10,10,10,10,10,10},
        {10,10,10,10,10,10,33,33,33,10},
        {10,44,45,44,10,10,33,33,33,10},
        {10,10,10,10,10,10,33,33,33,10},
        {10,10,10,10,10,10,10,10,10,10}
    };

    private static final int[][] BLOCKS_AND_SPIKES_MAXIMA = {
        {0,0,0,0,0,0,0,0,0,0},
        {0,1,1,1,0,0,0,0,0,0},
        {0,1,0,1,0,0,0,0,0,0},
        {0,1,1,1,0,0,0,0,0,0},
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,1,1,1,0},
        {0,0,1,0,0,0,1,0,1,0},
        {0,0,0,0,0,0,1,1,1,0},
        {0,0,0,0,0,0,0,0,0,0}
    };

    // The same 33 plateau but with the spikes punched through the middle row of the 22 block.
    private static final double[][] SPIKES_IN_BLOCK = {
        {10,10,10,10,10,10,10,10,10,10},
        {10,22,22,22,10,10,10,10,10,10},
        {10,44,45,44,10,10,10,10,10,10},
        {10,22,22,22,10,10,10,10,10,10},
        {10,10,10,10,10,10,10,10,10,10},
        {10,10,10,10,10,10,10,10,10,10},
        {10,10,10,10,10,10,33,33,33,10},
        {10,10,10,10,10,10,33,33,33,10},
        {10,10,10,10,10,10,33,33,33,10},
        {10,10,10,10,10,10,10,10,10,10}
    };

    private static final int[][] SPIKES_IN_BLOCK_MAXIMA = {
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,1,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,0,0,0,0},
        {0,0,0,0,0,0,1,1,1,0},
        {0,0,0,0,0,0,1,0,1,0},
        {0,0,0,0,0,0,1,1,1,0},
        {0,0,0,0,0,0,0,0,0,0}
    };

    private static MaxMask expected(final int[][] ones) {
        final boolean[][] ret = new boolean[ones.length][];
        for(int r = 0; r < ones.length; r++) {
            ret[r] = new boolean[ones[r].length];
            for(int c = 0; c < ones[r].length; c++)
                ret[r][c] = ones[r][c] != 0;
        }
        return MaxMask.of(ret);
    }

    @Test
    public void testBlocksAndSpikes() {
        final MaxMask mask = new ExtremaDetector(Neighborhood.DEFAULT).detect(BLOCKS_AND_SPIKES);
        assertEquals(expected(BLOCKS_AND_SPIKES_MAXIMA), mask);

        // the plateau centers aren't maxima
        assertFalse(mask.get(2, 2));
        assertFalse(mask.get(7, 7));
        // only the tallest spike survives
        assertTrue(mask.get(7, 2));
        assertFalse(mask.get(7, 1));
        assertFalse(mask.get(7, 3));
        assertEquals(8 + 8 + 1, mask.count());
    }

    @Test
    public void testSpikesBreakThePlateau() {
        assertEquals(expected(SPIKES_IN_BLOCK_MAXIMA), new ExtremaDetector(Neighborhood.DEFAULT).detect(SPIKES_IN_BLOCK));
    }

    @Test
    public void testDefaultConstructorUsesConfiguredNeighborhood() {
        final ExtremaDetector detector = new ExtremaDetector();
        assertEquals(Neighborhood.square(3), detector.neighborhood());
        assertEquals(expected(BLOCKS_AND_SPIKES_MAXIMA), detector.detect(BLOCKS_AND_SPIKES));
    }

    @Test
    public void testConstantFieldHasNoMaxima() {
        final double[][] field = new double[7][5];
        for(final double[] row: field)
            Arrays.fill(row, 3.25);

        final MaxMask mask = new ExtremaDetector(Neighborhood.DEFAULT).detect(field);
        assertEquals(7, mask.rows());
        assertEquals(5, mask.cols());
        assertEquals(0, mask.count());
        assertTrue(mask.locations().isEmpty());
    }

    @Test
    public void testMaskHasTheShapeOfTheField() {
        final double[][] field = new double[4][11];
        for(int r = 0; r < field.length; r++)
            for(int c = 0; c < field[r].length; c++)
                field[r][c] = Math.sin(r * 1.3) * Math.cos(c * 0.7);

        final MaxMask mask = new ExtremaDetector(Neighborhood.square(5)).detect(field);
        assertEquals(4, mask.rows());
        assertEquals(11, mask.cols());
    }

    @Test
    public void testMaximaOnTheBorderAreReported() {
        final double[][] field = {
            {5,5,1,1,1,1},
            {1,1,1,1,1,1},
            {1,1,1,1,1,1},
            {1,1,1,1,1,1},
            {1,1,1,1,1,7}
        };

        final MaxMask mask = new ExtremaDetector(Neighborhood.DEFAULT).detect(field);
        assertEquals(List.of(new SimplePoint(0, 0), new SimplePoint(0, 1), new SimplePoint(4, 5)), mask.locations());
    }

    @Test
    public void testLargerNeighborhoodSuppressesNearbyPeaks() {
        final double[][] field = new double[9][9];
        field[4][2] = 5;
        field[4][5] = 9;

        assertEquals(2, new ExtremaDetector(Neighborhood.DEFAULT).detect(field).count());

        final MaxMask wide = new ExtremaDetector(Neighborhood.square(7)).detect(field);
        assertEquals(List.of(new SimplePoint(4, 5)), wide.locations());
    }

    @Test
    public void testDetectAcceptsAnyDepthAndLeavesTheFieldAlone() {
        try(final CvMat field = new CvMat(5, 5, CvType.CV_8UC1);) {
            field.setTo(new Scalar(2));
            field.put(2, 2, 9);

            final MaxMask mask = new ExtremaDetector(Neighborhood.DEFAULT).detect(field);
            assertEquals(List.of(new SimplePoint(2, 2)), mask.locations());

            assertEquals(CvType.CV_8UC1, field.type());
            assertEquals(9.0, field.get(2, 2)[0], 0.0);
            assertEquals(2.0, field.get(0, 0)[0], 0.0);
        }
    }

    @Test
    public void testDetectMatIsZeroOne() {
        try(final CvMat field = Utils.toMat(BLOCKS_AND_SPIKES);
            final CvMat mask = new ExtremaDetector(Neighborhood.DEFAULT).detectMat(field);) {
            assertEquals(CvType.CV_8UC1, mask.type());
            assertEquals(1.0, mask.get(7, 2)[0], 0.0);
            assertEquals(0.0, mask.get(2, 2)[0], 0.0);
            assertEquals(expected(BLOCKS_AND_SPIKES_MAXIMA), MaxMask.of(Utils.toBooleanGrid(mask)));
        }
    }

    @Test(expected = ShapeMismatchException.class)
    public void testRaggedFieldIsRejected() {
        new ExtremaDetector(Neighborhood.DEFAULT).detect(new double[][] {{1,2,3},{4,5}});
    }

    @Test(expected = ShapeMismatchException.class)
    public void testEmptyFieldIsRejected() {
        new ExtremaDetector(Neighborhood.DEFAULT).detect(new double[0][]);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testMultiChannelFieldIsRejected() {
        try(final CvMat field = new CvMat(4, 4, CvType.CV_8UC3);) {
            new ExtremaDetector(Neighborhood.DEFAULT).detect(field);
        }
    }
}
