package com.bluxguard.core.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HashChain 单元测试")
class HashChainTest {

    private static final List<String> LINES = List.of("{\"seq\":0}", "{\"seq\":1}", "{\"seq\":2}");

    @Test
    @DisplayName("空链摘要为空串")
    void emptyChainHasNoDigest() {
        HashChain chain = new HashChain();

        assertEquals("", chain.digestHex());
        assertEquals(0, chain.length());
    }

    @Test
    @DisplayName("首个摘要等于 SHA256(空前缀 || 行)")
    void firstDigestSeedsFromEmptyPrefix() {
        HashChain chain = new HashChain();

        assertEquals(Digests.sha256Hex(LINES.get(0)), chain.nextHex(LINES.get(0)));
    }

    @Test
    @DisplayName("重放得到相同锚点")
    void replayReproducesAnchor() {
        HashChain chain = new HashChain();
        LINES.forEach(chain::nextHex);

        assertEquals(chain.digestHex(), HashChain.replay(LINES).digestHex());
        assertEquals(3, chain.length());
    }

    @Test
    @DisplayName("截断或重排都会改变锚点")
    void truncationAndReorderChangeAnchor() {
        String anchor = HashChain.replay(LINES).digestHex();

        List<String> reordered = new ArrayList<>(LINES);
        Collections.swap(reordered, 0, 1);

        assertNotEquals(anchor, HashChain.replay(LINES.subList(0, 2)).digestHex());
        assertNotEquals(anchor, HashChain.replay(reordered).digestHex());
    }

    @Test
    @DisplayName("从锚点继续等价于完整重放")
    void resumeFromAnchor() {
        HashChain prefix = HashChain.replay(LINES.subList(0, 2));
        HashChain resumed = new HashChain(Digests.fromHex(prefix.digestHex()), prefix.length());
        resumed.nextHex(LINES.get(2));

        assertEquals(HashChain.replay(LINES).digestHex(), resumed.digestHex());
    }
}
