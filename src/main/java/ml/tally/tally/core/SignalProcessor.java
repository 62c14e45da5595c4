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
package ml.tally.tally.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ml.tally.tally.container.Dataset;
import ml.tally.tally.container.FieldSelector;
import ml.tally.tally.container.Record;
import ml.tally.tally.exception.TallyErrorCode;
import ml.tally.tally.exception.TallyException;
import ml.tally.tally.util.Constants;

/**
 * Operations on numeric sequences: convolution, moving average, differences, running sums, linear resampling and the
 * discrete Fourier transform.
 * 
 * <p>
 * Positions matter in a signal, so unlike the statistics a signal does not skip values: every element must be a finite
 * number.
 */
public final class SignalProcessor {

    private SignalProcessor() {
    }

    /**
     * Full discrete convolution: output length is {@code signal.length + kernel.length - 1} and
     * {@code out[i] = sum(signal[j] * kernel[i - j])} over the j where both indexes are in range (zero padding at both
     * ends). An empty kernel or signal gives an empty output. Callers wanting a same-length output trim
     * {@code (kernel.length - 1) / 2} samples from each end.
     */
    public static double[] convolve(double[] signal, double[] kernel) {
        if(signal.length == 0 || kernel.length == 0) {
            return new double[0];
        }
        double[] out = new double[signal.length + kernel.length - 1];
        for(int i = 0; i < out.length; i++) {
            int from = Math.max(0, i - kernel.length + 1);
            int to = Math.min(i, signal.length - 1);
            double sum = 0d;
            for(int j = from; j <= to; j++) {
                sum += signal[j] * kernel[i - j];
            }
            out[i] = sum;
        }
        return out;
    }

    public static Dataset convolve(Dataset dataset, String field, double[] kernel) {
        return toDataset(convolve(signal(dataset, field, "convolve"), kernel));
    }

    /**
     * Trailing moving average, output length {@code n - window + 1}.
     */
    public static double[] movingAverage(double[] signal, int window) {
        checkWindow(signal, window);
        double[] out = new double[signal.length - window + 1];
        double sum = 0d;
        for(int i = 0; i < signal.length; i++) {
            sum += signal[i];
            if(i >= window) {
                sum -= signal[i - window];
            }
            if(i >= window - 1) {
                out[i - window + 1] = sum / window;
            }
        }
        return out;
    }

    /**
     * Moving average aligned with the input, output length n. A trailing window ends at its position; a centered window
     * is centered on it (for even windows the extra sample is on the left). Positions without a full window are NaN.
     */
    public static double[] movingAverage(double[] signal, int window, boolean centered) {
        double[] averages = movingAverage(signal, window);
        double[] out = new double[signal.length];
        Arrays.fill(out, Double.NaN);
        int offset = centered ? window / 2 : window - 1;
        System.arraycopy(averages, 0, out, offset, averages.length);
        return out;
    }

    public static Dataset movingAverage(Dataset dataset, String field, int window) {
        return toDataset(movingAverage(signal(dataset, field, "movingAverage"), window));
    }

    /**
     * First differences, output length {@code n - 1} (empty for less than 2 samples).
     */
    public static double[] differentiate(double[] signal) {
        if(signal.length < 2) {
            return new double[0];
        }
        double[] out = new double[signal.length - 1];
        for(int i = 1; i < signal.length; i++) {
            out[i - 1] = signal[i] - signal[i - 1];
        }
        return out;
    }

    public static Dataset differentiate(Dataset dataset, String field) {
        return toDataset(differentiate(signal(dataset, field, "differentiate")));
    }

    /**
     * Running sum starting at 0, output length {@code n + 1}.
     */
    public static double[] integrate(double[] signal) {
        double[] out = new double[signal.length + 1];
        for(int i = 0; i < signal.length; i++) {
            out[i + 1] = out[i] + signal[i];
        }
        return out;
    }

    public static Dataset integrate(Dataset dataset, String field) {
        return toDataset(integrate(signal(dataset, field, "integrate")));
    }

    /**
     * Linear resampling to the given number of evenly spaced points, first and last samples are kept.
     */
    public static double[] interpolate(double[] signal, int points) {
        if(points < 2) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Interpolation needs at least 2 points but got "
                    + points);
        }
        if(signal.length == 0) {
            return new double[0];
        }
        double[] out = new double[points];
        double step = (double) (signal.length - 1) / (points - 1);
        for(int i = 0; i < points; i++) {
            double x = i * step;
            int x0 = Math.min((int) Math.floor(x), signal.length - 1);
            int x1 = Math.min(x0 + 1, signal.length - 1);
            out[i] = signal[x0] + (signal[x1] - signal[x0]) * (x - x0);
        }
        return out;
    }

    public static Dataset interpolate(Dataset dataset, String field, int points) {
        return toDataset(interpolate(signal(dataset, field, "interpolate"), points));
    }

    /**
     * Radix-2 fast Fourier transform. The signal is zero-padded to the next power of two, so the output has that many
     * bins, each a {@code {real, imaginary}} pair with {@code X[k] = sum(x[j] * exp(-2 * pi * i * j * k / n))}. An
     * empty signal gives an empty output.
     */
    public static double[][] fft(double[] signal) {
        if(signal.length == 0) {
            return new double[0][];
        }
        int n = Integer.highestOneBit(signal.length);
        if(n < signal.length) {
            n <<= 1;
        }
        double[] re = Arrays.copyOf(signal, n);
        double[] im = new double[n];

        // bit reversal permutation
        for(int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for(; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if(i < j) {
                double tmp = re[i];
                re[i] = re[j];
                re[j] = tmp;
            }
        }

        for(int length = 2; length <= n; length <<= 1) {
            int half = length / 2;
            double step = -2d * Math.PI / length;
            for(int k = 0; k < half; k++) {
                double cos = Math.cos(step * k);
                double sin = Math.sin(step * k);
                for(int start = 0; start < n; start += length) {
                    int a = start + k;
                    int b = a + half;
                    double tr = cos * re[b] - sin * im[b];
                    double ti = sin * re[b] + cos * im[b];
                    re[b] = re[a] - tr;
                    im[b] = im[a] - ti;
                    re[a] += tr;
                    im[a] += ti;
                }
            }
        }

        double[][] bins = new double[n][];
        for(int k = 0; k < n; k++) {
            bins[k] = new double[] { re[k], im[k] };
        }
        return bins;
    }

    /**
     * @return one record per frequency bin with {@code real} and {@code imaginary} fields
     */
    public static Dataset fft(Dataset dataset, String field) {
        double[][] bins = fft(signal(dataset, field, "fft"));
        List<Record> records = new ArrayList<Record>(bins.length);
        for(double[] bin: bins) {
            records.add(Record.of(Constants.REAL, bin[0], Constants.IMAGINARY, bin[1]));
        }
        return Dataset.of(records);
    }

    /**
     * Numeric sequence of a field, or of the scalars when field is null.
     * 
     * @throws TallyException
     *             if any element is not a finite number
     */
    public static double[] signal(Dataset dataset, String field, String operation) {
        FieldSelector selector = FieldSelector.fieldOrSelf(field);
        double[] signal = new double[dataset.size()];
        int i = 0;
        for(Record record: dataset) {
            Double value = FieldAccessor.numeric(record, selector);
            if(value == null) {
                throw new TallyException(TallyErrorCode.ERROR_NON_NUMERIC_FIELD, "Operation " + operation
                        + " needs numbers only but element " + i + " of " + selector.getName() + " is "
                        + selector.select(record));
            }
            signal[i++] = value;
        }
        return signal;
    }

    public static Dataset toDataset(double[] values) {
        List<Record> records = new ArrayList<Record>(values.length);
        for(double value: values) {
            records.add(Record.ofScalar(value));
        }
        return Dataset.of(records);
    }

    private static void checkWindow(double[] signal, int window) {
        if(window < 1 || window > signal.length) {
            throw new TallyException(TallyErrorCode.ERROR_INVALID_ARGUMENT, "Invalid window size " + window
                    + " for a signal of " + signal.length + " samples");
        }
    }

}
