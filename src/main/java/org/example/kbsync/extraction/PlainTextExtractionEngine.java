package org.example.kbsync.extraction;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * txt / md 的抽取，两个等级都能直接得到最终结果
 */
@Component
public class PlainTextExtractionEngine implements ExtractionEngine {

    public static final String NAME = "plain-text";

    // ISO-8859-1 能解码任意字节，放在最后兜底
    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionResult extract(String filename, byte[] data) throws ExtractionException {
        int offset = hasUtf8Bom(data) ? UTF8_BOM.length : 0;
        for (Charset charset : CANDIDATES) {
            Optional<String> decoded = decode(charset, data, offset);
            if (decoded.isPresent()) {
                String text = decoded.get();
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("processor", NAME);
                metadata.put("encoding", charset.name());
                metadata.put("file_size", data.length);
                metadata.put("character_count", text.length());
                return new ExtractionResult(text, metadata);
            }
        }
        throw new ExtractionException("无法识别文件编码: " + filename);
    }

    private static Optional<String> decode(Charset charset, byte[] data, int offset) {
        try {
            return Optional.of(charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, offset, data.length - offset))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static boolean hasUtf8Bom(byte[] data) {
        return data.length >= 3 && data[0] == UTF8_BOM[0] && data[1] == UTF8_BOM[1] && data[2] == UTF8_BOM[2];
    }
}
