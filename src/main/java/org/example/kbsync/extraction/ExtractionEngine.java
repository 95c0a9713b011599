package org.example.kbsync.extraction;

/**
 * 抽取引擎。实现必须是无状态的，同一输入总是得到同一输出。
 */
public interface ExtractionEngine {

    String name();

    ExtractionResult extract(String filename, byte[] data) throws ExtractionException;
}
