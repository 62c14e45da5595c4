/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.tally.tally.container;

import ml.tally.tally.util.Constants;

/**
 * Population and sample standard deviation of a numeric field. Sample deviation is NaN with fewer than two values.
 */
public final class DispersionSummary {

    private final double population;

    private final double sample;

    public DispersionSummary(double population, double sample) {
        this.population = population;
        this.sample = sample;
    }

    public double getPopulation() {
        return population;
    }

    public double getSample() {
        return sample;
    }

    public Record toRecord() {
        return Record.of(Constants.POPULATION, population, Constants.SAMPLE, sample);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof DispersionSummary)) {
            return false;
        }
        DispersionSummary other = (DispersionSummary) o;
        return Double.compare(population, other.population) == 0 && Double.compare(sample, other.sample) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.valueOf(population).hashCode() + Double.valueOf(sample).hashCode();
    }

    @Override
    public String toString() {
        return "DispersionSummary [population=" + population + ", sample=" + sample + "]";
    }

}
