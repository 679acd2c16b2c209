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

import java.util.Properties;

import ai.kognition.stitchgeom.util.PropertiesUtils;

/**
 * <p>
 * Tunables for the detector and estimator. {@link #load()} starts from the defaults, then applies
 * the {@code stitchgeom.*} entries of a {@value #RESOURCE} file on the classpath (if there is one),
 * then any {@code STITCHGEOM_*} environment variable and finally any {@code -Dstitchgeom.*} system
 * property.
 * </p>
 *
 * <ul>
 * <li>{@code homography.degeneracy-tolerance} - the estimator rejects correspondences whose second
 * smallest singular value is no more than this fraction of the largest. Default {@value #DEFAULT_DEGENERACY_TOLERANCE}.</li>
 * <li>{@code extrema.neighborhood-size} - odd side length of the square window used by a default
 * constructed {@code ExtremaDetector}. Default {@value #DEFAULT_NEIGHBORHOOD_SIZE}.</li>
 * <li>{@code track-memory-leaks} - see {@link CvMat}. Default false.</li>
 * </ul>
 *
 * Instances are immutable. Nothing is cached; every call to {@link #load()} reads the sources again.
 */
public final class GeometryConfig {
    public static final String PREFIX = "stitchgeom";
    public static final String RESOURCE = "stitchgeom.properties";

    public static final String DEGENERACY_TOLERANCE = "homography.degeneracy-tolerance";
    public static final String NEIGHBORHOOD_SIZE = "extrema.neighborhood-size";
    public static final String TRACK_MEMORY_LEAKS = "track-memory-leaks";

    public static final double DEFAULT_DEGENERACY_TOLERANCE = 1.0E-10;
    public static final int DEFAULT_NEIGHBORHOOD_SIZE = 3;

    private final double degeneracyTolerance;
    private final int neighborhoodSize;
    private final boolean trackMemoryLeaks;

    public GeometryConfig(final double degeneracyTolerance, final int neighborhoodSize, final boolean trackMemoryLeaks) {
        if(!(degeneracyTolerance >= 0.0) || Double.isInfinite(degeneracyTolerance))
            throw new IllegalStateException("The \"" + DEGENERACY_TOLERANCE + "\" must be a finite, non-negative number. It was " + degeneracyTolerance);
        if(neighborhoodSize <= 0 || neighborhoodSize % 2 == 0)
            throw new IllegalStateException("The \"" + NEIGHBORHOOD_SIZE + "\" must be a positive, odd number. It was " + neighborhoodSize);
        this.degeneracyTolerance = degeneracyTolerance;
        this.neighborhoodSize = neighborhoodSize;
        this.trackMemoryLeaks = trackMemoryLeaks;
    }

    public static GeometryConfig defaults() {
        return new GeometryConfig(DEFAULT_DEGENERACY_TOLERANCE, DEFAULT_NEIGHBORHOOD_SIZE, false);
    }

    public static GeometryConfig load() {
        return from(PropertiesUtils.getSection(PropertiesUtils.loadFromClasspath(RESOURCE), PREFIX, true));
    }

    /**
     * @param props entries keyed without the {@value #PREFIX} prefix. Environment variables and system properties
     *            still take precedence.
     */
    public static GeometryConfig from(final Properties props) {
        return new GeometryConfig(
            PropertiesUtils.getDouble(props, PREFIX, DEGENERACY_TOLERANCE, DEFAULT_DEGENERACY_TOLERANCE),
            PropertiesUtils.getInt(props, PREFIX, NEIGHBORHOOD_SIZE, DEFAULT_NEIGHBORHOOD_SIZE),
            PropertiesUtils.getBoolean(props, PREFIX, TRACK_MEMORY_LEAKS, false));
    }

    public double degeneracyTolerance() {
        return degeneracyTolerance;
    }

    public int neighborhoodSize() {
        return neighborhoodSize;
    }

    public boolean trackMemoryLeaks() {
        return trackMemoryLeaks;
    }

    @Override
    public String toString() {
        return "GeometryConfig [degeneracyTolerance=" + degeneracyTolerance + ", neighborhoodSize=" + neighborhoodSize + ", trackMemoryLeaks="
            + trackMemoryLeaks + "]";
    }
}
