package me.golemcore.context.lexical;

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

import me.golemcore.context.domain.component.TopicComponent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Default {@link TopicComponent}: ordered keyword rules, first match wins.
 * Rules cover English and German phrasing since memories are stored in the
 * user's language.
 *
 * @since 1.0
 */
@Component
public class KeywordTopicComponent implements TopicComponent {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS;

    // Ordered by specificity
    private static final List<TopicRule> RULES = List.of(
            new TopicRule("identity", Pattern.compile("\\b(name|heiße?|heisse?|bin|called)\\b", FLAGS)),
            new TopicRule("spouse",
                    Pattern.compile("\\b(wife|husband|partner|spouse|fiancée?|girlfriend|boyfriend)\\b", FLAGS)),
            new TopicRule("parents", Pattern.compile("\\b(mother|father|mom|dad|parent|mutter|vater)\\b", FLAGS)),
            new TopicRule("children", Pattern.compile("\\b(child|son|daughter|kid|kinder)\\b", FLAGS)),
            new TopicRule("friends", Pattern.compile("\\b(friend|freund)\\b", FLAGS)),
            new TopicRule("work", Pattern.compile("\\b(work|job|career|arbeit|beruf)\\b", FLAGS)),
            new TopicRule("health", Pattern.compile("\\b(health|sick|pain|doctor|arzt|gesund)\\b", FLAGS)),
            new TopicRule("goals", Pattern.compile("\\b(goal|plan|want to|möchte|ziel)\\b", FLAGS)),
            new TopicRule("preferences", Pattern.compile("\\b(like|love|prefer|favorite|mag|liebe)\\b", FLAGS)),
            new TopicRule("location", Pattern.compile("\\b(live|home|wohne|hometown)\\b", FLAGS)));

    @Override
    public String extractTopic(String content) {
        if (content == null || content.isBlank()) {
            return GENERAL_TOPIC;
        }
        for (TopicRule rule : RULES) {
            if (rule.pattern().matcher(content).find()) {
                return rule.topic();
            }
        }
        return GENERAL_TOPIC;
    }

    private record TopicRule(String topic, Pattern pattern) {
    }
}
