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
 * Extracts a coarse topic label used for topic saturation control.
 */
public interface TopicComponent extends Component {

    String GENERAL_TOPIC = "general";

    @Override
    default String getComponentType() {
        return "topic";
    }

    /**
     * Returns the primary topic of the content, or {@link #GENERAL_TOPIC} when no
     * rule matches.
     *
     * @param content
     *            the text to classify
     * @return topic label, never null
     */
    String extractTopic(String content);
}
