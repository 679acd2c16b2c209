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
 * Root of the failures raised by the maxima detector and the homography estimate/apply operations.
 * Every failure is detected at the boundary of the operation and none of them are worth retrying
 * with the same input.
 */
public class GeometryException extends RuntimeException {
    private static final long serialVersionUID = -3318570943377250166L;

    public GeometryException() {}

    public GeometryException(final String msg) {
        super(msg);
    }

    public GeometryException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
