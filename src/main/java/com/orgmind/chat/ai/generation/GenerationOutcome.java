package com.orgmind.chat.ai.generation;

/**
 * 归一化后的生成结果。
 *
 * @param fragmentsEmitted 已写入 sink 的片段数
 * @param error            真正的失败；成功时为 null
 * @param suppressedError  已产出片段后流末尾携带的错误，被视为正常结束，仅用于日志
 */
public record GenerationOutcome(int fragmentsEmitted, GenerationException error, Throwable suppressedError) {

    public static GenerationOutcome success(int fragmentsEmitted, Throwable suppressedError) {
        return new GenerationOutcome(fragmentsEmitted, null, suppressedError);
    }

    public static GenerationOutcome failure(int fragmentsEmitted, GenerationException error) {
        return new GenerationOutcome(fragmentsEmitted, error, null);
    }

    public boolean succeeded() {
        return error == null;
    }
}
