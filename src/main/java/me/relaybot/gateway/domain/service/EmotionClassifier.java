package me.relaybot.gateway.domain.service;

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

import me.relaybot.gateway.domain.model.TurnEventType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps answer text to an avatar emotion tag using an ordered keyword table.
 * Rules are evaluated top to bottom against the lowercased text and the first
 * match wins.
 */
@Component
public class EmotionClassifier {

    public static final String NEUTRAL = "neutral";

    private static final List<Rule> RULES = List.of(
            // Negative
            new Rule("抱歉|对不起|不好意思|很遗憾|无法|做不到|失败|出错|错误|error|fail", "sad"),
            new Rule("不知道|不确定|不太清楚|不了解", "confused"),
            new Rule("危险|警告|注意|小心|千万不要|禁止", "shocked"),
            new Rule("哈哈|哈哈哈|23333|笑死|太搞笑|逗", "laughing"),
            // Positive
            new Rule("完成|搞定|成功|装好|已安装|已配置|已创建|已修改|已删除|已更新|好了|弄好", "happy"),
            new Rule("太好了|太棒了|厉害|不错|很好|恭喜|棒|赞|nice|great|awesome", "happy"),
            new Rule("好的|收到|明白|了解|可以|没问题|当然", "winking"),
            new Rule("你好|嗨|hello|hi|hey|早上好|晚上好|下午好", "happy"),
            // Content-specific
            new Rule("天气.*晴|阳光|温暖", "happy"),
            new Rule("天气.*雨|下雨|暴雨", "sad"),
            new Rule("好吃|美食|推荐.*餐|食谱", "delicious"),
            new Rule("爱|喜欢|❤|最爱|太美", "loving"),
            new Rule("累|疲|困了|睡觉|休息", "sleepy"),
            new Rule("酷|帅|牛|666|nb|强", "cool"),
            new Rule("嗯|让我想想|这个问题", "thinking"),
            new Rule("惊|wow|哇|居然|没想到|竟然", "surprised"),
            new Rule("尴尬|emmm|额|呃", "embarrassed"),
            new Rule("生气|愤怒|气死|烦|讨厌", "angry"));

    private static final Map<TurnEventType, String> EVENT_EMOTIONS = Map.of(
            TurnEventType.THINKING, "thinking",
            TurnEventType.TOOL_CALL, "gear",
            TurnEventType.TOOL_RESULT, "cool");

    public String classify(String text) {
        if (text == null || text.isEmpty()) {
            return NEUTRAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(lower).find()) {
                return rule.emotion();
            }
        }
        return NEUTRAL;
    }

    /**
     * Fixed emotion for progress events, or {@code null} for kinds that carry
     * none.
     */
    public String forEvent(TurnEventType type) {
        return EVENT_EMOTIONS.get(type);
    }

    private record Rule(Pattern pattern, String emotion) {

        Rule(String regex, String emotion) {
            this(Pattern.compile(regex), emotion);
        }
    }
}
