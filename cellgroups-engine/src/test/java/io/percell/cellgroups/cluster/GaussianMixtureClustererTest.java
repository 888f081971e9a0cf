/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.percell.cellgroups.cluster;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class GaussianMixtureClustererTest {

    private static final double MEAN_TOLERANCE = 0.3;

    private static double[] bimodal(int n, double a, double b, double sd, long seed) {
        Random random = new Random(seed);
        double[] data = new double[n];
        for (int i = 0; i < n; i++) {
            data[i] = (i % 2 == 0 ? a : b) + sd * random.nextGaussian();
        }
        return data;
    }

    @Test
    void recoversTwoSeparatedComponents() {
        double[] data = bimodal(400, -3.0, 3.0, 0.5, 42L);

        GaussianMixtureClusterer.MixtureResult result = new GaussianMixtureClusterer(2, 0L).fit(data);

        double[] means = result.means().clone();
        Arrays.sort(means);
        assertThat(means[0]).isCloseTo(-3.0, within(MEAN_TOLERANCE));
        assertThat(means[1]).isCloseTo(3.0, within(MEAN_TOLERANCE));
        assertThat(Arrays.stream(result.weights()).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(result.converged()).isTrue();

        int[] labels = result.hardAssignments();
        for (int i = 2; i < data.length; i++) {
            assertThat(labels[i]).isEqualTo(labels[i % 2]);
        }
        assertThat(result.distinctComponents()).isEqualTo(2);
    }

    @Test
    void responsibilitiesAreDistributions() {
        double[] data = bimodal(60, 0.0, 1.0, 0.8, 1L);

        GaussianMixtureClusterer.MixtureResult result = new GaussianMixtureClusterer(3, 5L).fit(data);

        for (double[] row : result.responsibilities()) {
            assertThat(Arrays.stream(row).sum()).isCloseTo(1.0, within(1e-9));
        }
        for (double variance : result.variances()) {
            assertThat(variance).isGreaterThanOrEqualTo(1e-4);
        }
    }

    @Test
    void bicPrefersTwoComponentsForBimodalData() {
        double[] data = bimodal(300, 0.0, 10.0, 1.0, 9L);

        double bic1 = new GaussianMixtureClusterer(1, 0L).fit(data).bic();
        double bic2 = new GaussianMixtureClusterer(2, 0L).fit(data).bic();

        assertThat(bic2).isLessThan(bic1);
    }

    @Test
    void freeParametersCountMeansVariancesAndWeights() {
        GaussianMixtureClusterer.MixtureResult result =
            new GaussianMixtureClusterer(3, 0L).fit(new double[]{1, 2, 3, 10, 11, 12, 20, 21, 22});

        assertThat(result.freeParameters()).isEqualTo(8);
        assertThat(result.bic()).isEqualTo(-2 * result.logLikelihood() + 8 * Math.log(9));
    }

    @Test
    void isDeterministicForASeed() {
        double[] data = bimodal(80, 1.0, 2.0, 0.7, 3L);

        GaussianMixtureClusterer.MixtureResult first = new GaussianMixtureClusterer(3, 17L).fit(data);
        GaussianMixtureClusterer.MixtureResult second = new GaussianMixtureClusterer(3, 17L).fit(data);

        assertThat(second.hardAssignments()).containsExactly(first.hardAssignments());
        assertThat(second.logLikelihood()).isEqualTo(first.logLikelihood());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new GaussianMixtureClusterer(0, 0L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GaussianMixtureClusterer(2, 1, 1, 0.0, 1e-3, 0L))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GaussianMixtureClusterer(3, 0L).fit(new double[]{1, 2}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
