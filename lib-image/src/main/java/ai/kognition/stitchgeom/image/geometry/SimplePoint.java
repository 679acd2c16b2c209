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

package ai.kognition.stitchgeom.image.geometry;

/**
 * Immutable {@link Point}.
 */
public class SimplePoint implements Point {
    private final double r;
    private final double c;

    public SimplePoint(final double r, final double c) {
        this.r = r;
        this.c = c;
    }

    @Override
    public double getRow() {
        return r;
    }

    @Override
    public double getCol() {
        return c;
    }

    @Override
    public String toString() {
        return Point.toString(this);
    }

    @Override
    public int hashCode() {
        return (31 * Double.hashCode(r)) + Double.hashCode(c);
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final SimplePoint other = (SimplePoint)obj;
        return Double.doubleToLongBits(r) == Double.doubleToLongBits(other.r)
            && Double.doubleToLongBits(c) == Double.doubleToLongBits(other.c);
    }
}
