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

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

/**
 * Owns loading of the OpenCV native library. Any class that touches {@code org.opencv.*}
 * natives should call {@link #_init()} from its static initializer so that the library is
 * loaded exactly once, before first use.
 */
public class ImageAPI {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageAPI.class);

    static void _init() {}

    static {
        LOGGER.debug("Loading the OpenCV native library bundled with the Java bindings");
        OpenCV.loadLocally();
        LOGGER.debug("Loaded OpenCV {}", Core.VERSION);
    }
}
