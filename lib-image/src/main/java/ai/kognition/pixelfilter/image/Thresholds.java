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

package ai.kognition.pixelfilter.image;

/**
 * The low and high edge strength thresholds used by the {@link HysteresisThresholder}.
 */
public final class Thresholds {
    public final double low;
    public final double high;

    public Thresholds(final double low, final double high) {
        if(Double.isNaN(low) || Double.isNaN(high))
            throw new IllegalArgumentException("Thresholds must be numbers (low=" + low + ", high=" + high + ")");
        if(low > high)
            throw new IllegalArgumentException("The low threshold (" + low + ") can't be greater than the high threshold (" + high + ")");
        this.low = low;
        this.high = high;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        long temp = Double.doubleToLongBits(high);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(low);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null)
            return false;
        if(getClass() != obj.getClass())
            return false;
        final Thresholds other = (Thresholds)obj;
        return Double.doubleToLongBits(high) == Double.doubleToLongBits(other.high)
            && Double.doubleToLongBits(low) == Double.doubleToLongBits(other.low);
    }

    @Override
    public String toString() {
        return "Thresholds [low=" + low + ", high=" + high + "]";
    }
}
