package com.nei10u.bazi.service;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import com.nei10u.bazi.exception.ResultWriteException;
import com.nei10u.bazi.model.BaziResponse;
import com.nei10u.bazi.model.BirthInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 结果写到 {@code <目录>/<姓名>_<出生日期>/result.json}。
 */
@Component
public class JsonFileResultWriter implements PersistenceWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonFileResultWriter.class);

    static final String FILE_NAME = "result.json";
    static final String UNKNOWN_NAME = "未知";

    private final String directory;

    public JsonFileResultWriter(@Value("${bazi.output.directory:output}") String directory) {
        this.directory = directory;
    }

    @Override
    public Path write(BaziResponse response) throws ResultWriteException {
        String name = directoryName(response);
        String target = directory + "/" + name + "/" + FILE_NAME;
        try {
            Path dir = Paths.get(directory).resolve(name);
            Path file = dir.resolve(FILE_NAME);
            Files.createDirectories(dir);
            String json = JSON.toJSONString(response,
                    JSONWriter.Feature.PrettyFormat,
                    JSONWriter.Feature.WriteMapNullValue,
                    JSONWriter.Feature.WriteEnumUsingToString);
            Files.writeString(file, json, StandardCharsets.UTF_8);
            log.info("[{}] 结果已写入 {}", response.getRequestId(), file);
            return file;
        } catch (IOException | InvalidPathException e) {
            throw new ResultWriteException("写入结果失败: " + target, e);
        }
    }

    static String directoryName(BaziResponse response) {
        String name = StringUtils.hasText(response.getName()) ? response.getName().trim() : UNKNOWN_NAME;
        // 去掉控制字符，路径分隔符等非法字符换成下划线
        name = name.replaceAll("\\p{Cntrl}", "").replaceAll("[\\\\/:*?\"<>|]", "_");
        if (name.isBlank()) {
            name = UNKNOWN_NAME;
        }
        BirthInput input = response.getAnalysis().getInput();
        return String.format("%s_%04d%02d%02d", name, input.getYear(), input.getMonth(), input.getDay());
    }
}
