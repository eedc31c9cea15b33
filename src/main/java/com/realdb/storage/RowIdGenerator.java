package com.realdb.storage;

import java.security.SecureRandom;
import java.util.Random;

/**
 * RowIdGenerator - 随机行号生成器
 *
 * 为 @table:_ 形式的标识字面量生成64位行号。
 * 整个进程共享一个实例,只在启动时播种一次(SecureRandom),
 * 避免同一秒内到达的请求生成相同的行号。
 *
 * 线程安全: nextRow()是同步方法,编译阶段不持有Database锁也能安全调用。
 */
public class RowIdGenerator {

    private final Random random;

    /**
     * 使用SecureRandom播种的生成器
     */
    public RowIdGenerator() {
        this(new Random(new SecureRandom().nextLong()));
    }

    /**
     * 使用指定随机源(测试时传入固定种子)
     *
     * @param random 随机源
     */
    public RowIdGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random source cannot be null");
        }
        this.random = random;
    }

    /**
     * 生成下一个行号(按无符号64位解释)
     */
    public synchronized long nextRow() {
        return random.nextLong();
    }
}
