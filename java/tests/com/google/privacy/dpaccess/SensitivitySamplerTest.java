//
// Copyright 2026 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//

package com.google.privacy.dpaccess;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.privacy.dpaccess.SensitivitySampler.SamplingPolicy;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SensitivitySamplerTest {
  private static final int SAMPLE_SIZE = 100;

  @Test
  public void sampleSensitivity_meanOfUnitInterval_isBoundedByOneOverSampleSize() {
    SensitivitySampler sampler =
        SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).numSamples(500).build();

    SensitivityEstimate estimate =
        sampler.sampleSensitivity(
            new Mean(), new L1SensitivityNorm(), new UniformProbabilityDistribution(0, 1));

    // Replacing one of n values in [0, 1) moves the mean by less than 1 / n.
    assertThat(estimate.sensitivity()).isGreaterThan(0.0);
    assertThat(estimate.sensitivity()).isAtMost(1.0 / SAMPLE_SIZE);
    assertThat(estimate.mean()).isAtMost(estimate.sensitivity());
    assertThat(estimate.numSamples()).isEqualTo(500);
    assertThat(estimate.gamma()).isEqualTo(sampler.getGamma());
  }

  @Test
  public void sampleSensitivity_independentDatabases_observesLargerDistances() {
    SensitivitySampler neighboring =
        SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).numSamples(500).build();
    SensitivitySampler independent =
        SensitivitySampler.builder()
            .sampleSize(SAMPLE_SIZE)
            .numSamples(500)
            .samplingPolicy(SamplingPolicy.INDEPENDENT)
            .build();
    UniformProbabilityDistribution distribution = new UniformProbabilityDistribution(0, 1);

    SensitivityEstimate neighboringEstimate =
        neighboring.sampleSensitivity(new Mean(), new L1SensitivityNorm(), distribution);
    SensitivityEstimate independentEstimate =
        independent.sampleSensitivity(new Mean(), new L1SensitivityNorm(), distribution);

    // Independent means differ by about 0.04 on average, neighboring ones by at most 0.01.
    assertThat(independentEstimate.mean()).isGreaterThan(neighboringEstimate.mean());
    assertThat(independentEstimate.sensitivity()).isAtMost(1.0);
  }

  @Test
  public void sampleSensitivity_identityWithL2Norm_isBoundedByRange() {
    SensitivitySampler sampler =
        SensitivitySampler.builder().sampleSize(10).numSamples(200).build();

    SensitivityEstimate estimate =
        sampler.sampleSensitivity(
            new IdentityFunction<double[]>(),
            new L2SensitivityNorm(),
            new UniformProbabilityDistribution(0, 1));

    assertThat(estimate.sensitivity()).isAtMost(1.0);
  }

  @Test
  public void sampleSensitivity_datasetTooSmall_throwsException() {
    SensitivitySampler sampler =
        SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).numSamples(10).build();

    assertThrows(
        IllegalArgumentException.class,
        () ->
            sampler.sampleSensitivity(
                new Mean(), new L1SensitivityNorm(), new DatasetDistribution(new double[50])));
  }

  @Test
  public void build_gamma_derivesNumberOfSamples() {
    SensitivitySampler sampler =
        SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).gamma(0.05).build();

    assertThat(sampler.getGamma()).isEqualTo(0.05);
    // The minimum of ln(1 / rho) / (2 * (0.05 - rho)^2) is about 1304.5, reached at rho = 0.0042.
    assertThat(sampler.getNumSamples()).isEqualTo(1305);
  }

  @Test
  public void numSamplesForGamma_decreasesWithGamma() {
    assertThat(SensitivitySampler.numSamplesForGamma(0.1))
        .isLessThan(SensitivitySampler.numSamplesForGamma(0.05));
  }

  @Test
  public void numSamplesForGamma_tooManySamplesRequired_throwsException() {
    // At least ln(1 / gamma) / (2 * gamma^2), about 5.8e10 samples, exceeds the int range.
    assertThrows(
        IllegalArgumentException.class, () -> SensitivitySampler.numSamplesForGamma(1e-5));
  }

  @Test
  public void gammaForNumSamples_achievesConfiguredGamma() {
    int numSamples = SensitivitySampler.numSamplesForGamma(0.05);

    assertThat(SensitivitySampler.gammaForNumSamples(numSamples)).isAtMost(0.05 + 1e-6);
    assertThat(SensitivitySampler.gammaForNumSamples(numSamples)).isGreaterThan(0.0);
  }

  @Test
  public void gammaForNumSamples_decreasesWithNumberOfSamples() {
    assertThat(SensitivitySampler.gammaForNumSamples(5000))
        .isLessThan(SensitivitySampler.gammaForNumSamples(500));
    assertThat(SensitivitySampler.gammaForNumSamples(500)).isWithin(1e-4).of(0.07744);
  }

  @Test
  public void build_neitherOrBothOfNumSamplesAndGamma_throwsException() {
    assertThrows(
        IllegalStateException.class,
        () -> SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).build());
    assertThrows(
        IllegalStateException.class,
        () ->
            SensitivitySampler.builder()
                .sampleSize(SAMPLE_SIZE)
                .numSamples(10)
                .gamma(0.1)
                .build());
  }

  @Test
  public void build_invalidParameters_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SensitivitySampler.builder().sampleSize(0).numSamples(10).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).numSamples(0).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> SensitivitySampler.builder().sampleSize(SAMPLE_SIZE).gamma(1.5).build());
  }
}
