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
 * Maps a point from one image's coordinate frame into another's.
 */
@FunctionalInterface
public interface Transform2D {

    public Point transform(final Point point);

    /**
     * @return a transform that applies {@code this} and then {@code next}.
     */
    default public Transform2D andThen(final Transform2D next) {
        return p -> next.transform(transform(p));
    }
}
