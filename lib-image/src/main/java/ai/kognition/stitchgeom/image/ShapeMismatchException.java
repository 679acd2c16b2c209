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
 * Thrown when paired inputs differ in length or a grid/matrix isn't the shape required
 * (empty, ragged, multi-channel or not 3x3).
 */
public class ShapeMismatchException extends GeometryException {
    private static final long serialVersionUID = 6203144951764532318L;

    public ShapeMismatchException(final String msg) {
        super(msg);
    }

    public ShapeMismatchException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
