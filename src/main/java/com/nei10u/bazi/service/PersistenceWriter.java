package com.nei10u.bazi.service;

import com.nei10u.bazi.exception.ResultWriteException;
import com.nei10u.bazi.model.BaziResponse;

import java.nio.file.Path;

/**
 * 将最终结果写入持久存储。
 */
public interface PersistenceWriter {

    /**
     * @return 写入的文件路径
     */
    Path write(BaziResponse response) throws ResultWriteException;
}
