package me.golemcore.context.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Pairwise content similarity used for redundancy detection and diversity
 * scoring. Implementations must be deterministic and symmetric.
 */
public interface SimilarityComponent extends Component {

    @Override
    default String getComponentType() {
        return "similarity";
    }

    /**
     * Computes similarity between two text fragments.
     *
     * @param first
     *            first fragment
     * @param second
     *            second fragment
     * @return similarity in the range 0.0 (disjoint) to 1.0 (identical)
     */
    double similarity(String first, String second);
}
