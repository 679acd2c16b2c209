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

/**
 * Thrown when fewer correspondences than the 4 needed to fix the 8 degrees of freedom of a
 * homography are supplied.
 */
public class InsufficientCorrespondencesException extends GeometryException {
    private static final long serialVersionUID = 4459873209561174813L;

    private final int required;
    private final int actual;

    public InsufficientCorrespondencesException(final int required, final int actual) {
        super("At least " + required + " correspondences are required to estimate a homography but " + actual + " were supplied.");
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
