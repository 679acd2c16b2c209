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

import java.lang.ref.Cleaner;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * An OpenCV <a href="https://docs.opencv.org/4.9.0/d3/d63/classcv_1_1Mat.html">Mat</a> that can be
 * managed with a <em>"try-with-resource"</em>. The pixel data of a {@code Mat} lives off-heap where the
 * garbage collector can't see it, so every temporary matrix created while detecting maxima or estimating
 * a homography is released deterministically when its {@link CvMat} is closed.
 * </p>
 *
 * <h2>Tracking memory leaks</h2>
 *
 * Setting {@code -Dstitchgeom.track-memory-leaks=true} (or the environment variable
 * {@code STITCHGEOM_TRACK_MEMORY_LEAKS=true}) records where each {@link CvMat} was instantiated. If one
 * becomes unreachable without having been closed a {@code debug} level message identifying that location
 * is logged.
 */
public class CvMat extends Mat implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CvMat.class);
    private static final boolean TRACK_MEMORY_LEAKS;
    private static final Cleaner CLEANER = Cleaner.create();

    static {
        ImageAPI._init();
        TRACK_MEMORY_LEAKS = GeometryConfig.load().trackMemoryLeaks();
    }

    public static void initOpenCv() {}

    private boolean skipCloseOnceForReturn = false;
    private boolean deletedAlready = false;
    private final LeakState leakState;

    // Must not refer back to the CvMat or it will never become phantom reachable.
    private static class LeakState implements Runnable {
        private final RuntimeException stackTrace = new RuntimeException("Here's where I was instantiated: ");
        private volatile boolean closed = false;

        @Override
        public void run() {
            if(!closed)
                LOGGER.debug("A CvMat was never closed.", stackTrace);
        }
    }

    /**
     * Construct's an empty {@link CvMat}.
     */
    public CvMat() {
        leakState = track(this);
    }

    /**
     * Construct a {@link CvMat} and preallocate the space.
     *
     * @param rows number of rows
     * @param cols number of columns
     * @param type type of the {@link CvMat}. See {@link org.opencv.core.CvType}
     */
    public CvMat(final int rows, final int cols, final int type) {
        super(rows, cols, type);
        leakState = track(this);
    }

    private static LeakState track(final CvMat mat) {
        if(!TRACK_MEMORY_LEAKS)
            return null;
        final LeakState ret = new LeakState();
        CLEANER.register(mat, ret);
        return ret;
    }

    /**
     * Hand management of a {@code Mat}'s data over to a new {@link CvMat}. The {@code Mat} passed in
     * is released and shouldn't be used afterward.
     *
     * @return a new {@link CvMat} or null if {@code mat} is null. <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat move(final Mat mat) {
        if(mat == null)
            return null;

        final CvMat ret = new CvMat();
        mat.assignTo(ret);
        mat.release();
        return ret;
    }

    /**
     * @return a new {@link CvMat} with all zeros of the given proportions and type. <b>Note: The caller owns the CvMat
     *         returned</b>
     */
    public static CvMat zeros(final int rows, final int cols, final int type) {
        return CvMat.move(Mat.zeros(rows, cols, type));
    }

    /**
     * This method allows the developer to return a {@link CvMat} that's being managed by
     * a <em>"try-with-resource"</em> without the {@link CvMat}'s resources being freed:
     *
     * <pre>
     * <code>
     *   try (CvMat matToReturn = new CvMat(); ) {
     *      // do something to fill in the matToReturn
     *
     *      return matToReturn.returnMe();
     *   }
     * </code>
     * </pre>
     *
     * If an exception is thrown before the {@code return} the {@link CvMat} is still released.
     */
    public CvMat returnMe() {
        skipCloseOnceForReturn = true;
        return this;
    }

    /**
     * Free the data held by this {@link CvMat}. Closing more than once has no further effect.
     */
    @Override
    public void close() {
        if(!skipCloseOnceForReturn) {
            if(!deletedAlready) {
                release();
                deletedAlready = true;
                if(leakState != null)
                    leakState.closed = true;
            }
        } else
            skipCloseOnceForReturn = false; // next close counts.
    }

    public boolean isClosed() {
        return deletedAlready;
    }

    @Override
    public String toString() {
        return "CvMat: (" + getClass().getName() + "@" + Integer.toHexString(hashCode()) + ") " + super.toString();
    }
}
