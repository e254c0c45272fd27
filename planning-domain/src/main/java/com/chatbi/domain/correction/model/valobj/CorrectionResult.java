package com.chatbi.domain.correction.model.valobj;

import java.util.List;
import java.util.Map;

/**
 * 纠错重试结果。
 *
 * @param finalSql 最终执行成功的语句
 * @param rows 执行结果
 * @param attempts 执行器调用次数
 */
public record CorrectionResult(String finalSql,
                               List<Map<String, Object>> rows,
                               int attempts) {

    public boolean corrected() {
        return attempts > 1;
    }
}
