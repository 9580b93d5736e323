package com.github.flashcard.card;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * JSON-lines 卡片文件导入/导出
 *
 * 每行一条记录：{"term":"..","def":"..","errors":N}，errors 可省略。
 * 文件句柄只在单次调用内打开，所有退出路径都会关闭。
 */
public final class CardFiles {
    private static final Logger log = LoggerFactory.getLogger(CardFiles.class);

    private final ObjectMapper mapper;

    public CardFiles() {
        // 一行只能有一条记录，尾部多余内容视为格式错误
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public CardFiles(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 按文件行序导入，每条成功解析的记录调用一次 store.put
     * 格式错误的行记录告警后跳过，不会写入仓库
     *
     * @return 成功导入的卡片数
     * @throws NoSuchFileException 文件不存在
     */
    public int importFrom(Path file, CardStore store) throws NoSuchFileException {
        int loaded = 0;
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                CardRecord card;
                try {
                    card = mapper.readValue(line, CardRecord.class);
                } catch (JsonProcessingException e) {
                    log.warn("Skipping malformed card at {}:{}: {}", file, lineNo, e.getOriginalMessage());
                    continue;
                }
                if (card == null) {
                    // JSON 字面量 null
                    log.warn("Skipping malformed card at {}:{}: null record", file, lineNo);
                    continue;
                }
                store.put(card.term(), card.definition(), card.errors());
                loaded++;
            }
        } catch (NoSuchFileException e) {
            throw e;
        } catch (IOException e) {
            throw new CardFileException("Failed to read cards from " + file, e);
        }
        log.info("Imported {} cards from {}", loaded, file);
        return loaded;
    }

    /**
     * 按插入顺序导出全部卡片，覆盖已有文件
     *
     * @return 写出的卡片数
     */
    public int exportTo(Path file, CardStore store) {
        int exported = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (CardRecord card : store.cards()) {
                writer.write(mapper.writeValueAsString(card));
                writer.newLine();
                exported++;
            }
        } catch (IOException e) {
            throw new CardFileException("Failed to write cards to " + file, e);
        }
        log.info("Exported {} cards to {}", exported, file);
        return exported;
    }
}
