package tutoring.analytics.infrastructure.cache.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import tutoring.analytics.core.domain.model.CacheEntry;
import tutoring.analytics.error.exception.CacheSerializationException;

/**
 * 원격 계층(L2/L3) 저장 포맷
 *
 * <p>값과 저장/만료 시각을 JSON 봉투 하나로 직렬화합니다. 값은 타입 정보 없이 저장되므로 역직렬화 결과는 Map/List/스칼라이며, 호출자가
 * 요청한 타입으로의 변환은 오케스트레이터가 담당합니다.
 */
@RequiredArgsConstructor
public class CacheEntryJsonCodec {

  private final ObjectMapper objectMapper;

  public String encode(CacheEntry entry) throws JsonProcessingException {
    return objectMapper.writeValueAsString(
        new Envelope(
            entry.value(), entry.storedAt().toEpochMilli(), entry.expiresAt().toEpochMilli()));
  }

  public CacheEntry decode(String key, String json) throws JsonProcessingException {
    Envelope envelope = objectMapper.readValue(json, Envelope.class);
    return new CacheEntry(
        key,
        envelope.value(),
        Instant.ofEpochMilli(envelope.storedAt()),
        Instant.ofEpochMilli(envelope.expiresAt()));
  }

  /** 저장된 값을 호출자가 요청한 타입으로 변환 */
  public <T> T convert(String key, Object value, Class<T> type) {
    if (value == null || type.isInstance(value)) {
      return type.cast(value);
    }
    try {
      return objectMapper.convertValue(value, type);
    } catch (IllegalArgumentException e) {
      throw new CacheSerializationException(key, e);
    }
  }

  public record Envelope(Object value, long storedAt, long expiresAt) {}
}
