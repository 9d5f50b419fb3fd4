package com.codeheadsystems.tessera.server.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.server.exceptions.MalformedTokenException;
import com.codeheadsystems.tessera.server.model.RawSecret;
import com.codeheadsystems.tessera.server.model.SessionId;
import com.codeheadsystems.tessera.server.model.SessionTokenPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class SessionTokenCodecTest {

  private final SessionTokenCodec codec = new SessionTokenCodec();

  @Test
  void decode_recoversIdAndSecretExactly() {
    // Ids are opaque to the codec; separators inside them must survive.
    SessionTokenPayload payload = new SessionTokenPayload(
        new SessionId("tenant.a/7f3c"), new SecureRandomTokenGenerator().generate(128));

    String token = codec.encode(payload);

    assertThat(codec.decode(token)).isEqualTo(payload);
  }

  @Test
  void encode_isUrlSafe() {
    String token = codec.encode(new SessionTokenPayload(
        new SessionId("s-1"), new RawSecret(new byte[]{(byte) 0xfb, (byte) 0xff, 0x3e})));

    assertThat(token).matches("[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"no-separator", ".c2VjcmV0", "czE.", "czE.c2Vj.cmV0", "czE.!!!!"})
  void decode_malformed_throws(String token) {
    assertThatThrownBy(() -> codec.decode(token)).isInstanceOf(MalformedTokenException.class);
  }
}
