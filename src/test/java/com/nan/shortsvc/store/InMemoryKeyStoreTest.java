package com.nan.shortsvc.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.nan.shortsvc.exception.KeyDerivationException;
import com.nan.shortsvc.exception.KeyNotFoundException;
import com.nan.shortsvc.exception.ValueTooLargeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InMemoryKeyStoreTest {

    private static final String ALPHABET_DIGEST = "abcdefghijklmnopqrstuv";
    private static final String FLAT_DIGEST = "AAAAAAAAAAAAAAAAAAAAAA";

    @Mock
    ValueDigester digester;
    @Mock
    KeyStoreListener listener;

    @Test
    void createDerivesKeyFromFirstWindowOfDigest() {
        InMemoryKeyStore store = new InMemoryKeyStore();

        String key = store.create("12345");

        assertThat(key).isEqualTo("gnzLDu");
        assertThat(store.lookup("gnzLDu")).isEqualTo("12345");
    }

    @Test
    void recreatingSameValueReturnsExistingKeyWithoutNewEntry() {
        InMemoryKeyStore store = new InMemoryKeyStore(2083, 6, new ValueDigester(), listener);

        String first = store.create("12345");
        String second = store.create("12345");

        assertThat(second).isEqualTo(first);
        assertThat(store.size()).isEqualTo(1);
        verify(listener).onCreate("gnzLDu", false, 0);
        verify(listener).onCreate("gnzLDu", true, 0);
    }

    @Test
    void collisionSlidesWindowOneCharacterRight() {
        when(digester.digest("first")).thenReturn(ALPHABET_DIGEST);
        when(digester.digest("second")).thenReturn(ALPHABET_DIGEST);
        InMemoryKeyStore store = new InMemoryKeyStore(2083, 6, digester, listener);

        assertThat(store.create("first")).isEqualTo("abcdef");
        assertThat(store.create("second")).isEqualTo("bcdefg");

        verify(listener).onCreate("bcdefg", false, 1);
        assertThat(store.lookup("abcdef")).isEqualTo("first");
        assertThat(store.lookup("bcdefg")).isEqualTo("second");
    }

    @Test
    void recreateAfterCollisionRetracesProbeToSameKey() {
        when(digester.digest("first")).thenReturn(ALPHABET_DIGEST);
        when(digester.digest("second")).thenReturn(ALPHABET_DIGEST);
        InMemoryKeyStore store = new InMemoryKeyStore(2083, 6, digester, listener);
        store.create("first");
        store.create("second");

        assertThat(store.create("second")).isEqualTo("bcdefg");

        verify(listener).onCreate("bcdefg", true, 1);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void windowGrowsOnceEveryOffsetAtCurrentSizeIsTaken() {
        when(digester.digest("a")).thenReturn(FLAT_DIGEST);
        when(digester.digest("b")).thenReturn(FLAT_DIGEST);
        InMemoryKeyStore store = new InMemoryKeyStore(2083, 6, digester, listener);

        assertThat(store.create("a")).isEqualTo("AAAAAA");
        assertThat(store.create("b")).isEqualTo("AAAAAAA");

        // offsets 0..16 of width 6 all equal "AAAAAA"
        verify(listener).onCreate("AAAAAAA", false, 17);
    }

    @Test
    void distinctValuesSharingDigestPrefixNeverShareKey() {
        when(digester.digest("x")).thenReturn("zzzzzzAAAAAAAAAAAAAAAA");
        when(digester.digest("y")).thenReturn("zzzzzzBBBBBBBBBBBBBBBB");
        InMemoryKeyStore store = new InMemoryKeyStore(2083, 6, digester, KeyStoreListener.NOOP);

        String kx = store.create("x");
        String ky = store.create("y");

        assertThat(kx).isEqualTo("zzzzzz");
        assertThat(ky).isNotEqualTo(kx).isEqualTo("zzzzzB");
        assertThat(store.lookup(ky)).isEqualTo("y");
    }

    @Test
    void exhaustedDigestIsAnInternalError() {
        when(digester.digest("a")).thenReturn(FLAT_DIGEST);
        when(digester.digest("b")).thenReturn(FLAT_DIGEST);
        InMemoryKeyStore store = new InMemoryKeyStore(2083, ValueDigester.DIGEST_LENGTH, digester, listener);
        store.create("a");

        assertThatThrownBy(() -> store.create("b"))
                .isInstanceOf(KeyDerivationException.class)
                .hasMessageContaining("no free key");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void hashingFailurePropagatesWithoutMutation() {
        when(digester.digest(anyString())).thenThrow(new KeyDerivationException("failed to write hash"));
        InMemoryKeyStore store = new InMemoryKeyStore(2083, 6, digester, listener);

        assertThatThrownBy(() -> store.create("v")).isInstanceOf(KeyDerivationException.class);
        assertThat(store.size()).isZero();
        verify(listener, never()).onCreate(anyString(), anyBoolean(), anyInt());
    }

    @Test
    void createRejectsValueLongerThanMaxLen() {
        InMemoryKeyStore store = new InMemoryKeyStore(5, 6, digester, listener);

        assertThatThrownBy(() -> store.create("123456"))
                .isInstanceOf(ValueTooLargeException.class)
                .hasMessageContaining("6 > 5");
        assertThat(store.size()).isZero();
        verify(digester, never()).digest(anyString());
    }

    @Test
    void lengthIsMeasuredInUtf8Bytes() {
        InMemoryKeyStore store = new InMemoryKeyStore(5, 6, new ValueDigester(), listener);

        // 3 chars, 6 bytes
        assertThatThrownBy(() -> store.create("ééé")).isInstanceOf(ValueTooLargeException.class);
        assertThat(store.create("12345")).isEqualTo("gnzLDu");
    }

    @Test
    void valueAtExactlyMaxLenIsAccepted() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        String value = "a".repeat(InMemoryKeyStore.DEFAULT_MAX_LEN);

        String key = store.create(value);

        assertThat(store.lookup(key)).isEqualTo(value);
    }

    @Test
    void lookupRejectsKeyLongerThanMaxLen() {
        InMemoryKeyStore store = new InMemoryKeyStore();

        assertThatThrownBy(() -> store.lookup("k".repeat(2084))).isInstanceOf(ValueTooLargeException.class);
    }

    @Test
    void lookupOfUnknownKeyFails() {
        InMemoryKeyStore store = new InMemoryKeyStore();
        store.create("12345");

        assertThatThrownBy(() -> store.lookup("nope00"))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessageContaining("nope00");
        // prefix of an issued key is not a key
        assertThatThrownBy(() -> store.lookup("gnzLD")).isInstanceOf(KeyNotFoundException.class);
    }

    @Test
    void constructorValidatesLimits() {
        assertThatThrownBy(() -> new InMemoryKeyStore(0, 6, digester, listener))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryKeyStore(2083, 0, digester, listener))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryKeyStore(2083, 23, digester, listener))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
