package com.bluxguard.core.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 滚动哈希链
 * <p>
 * digest_n = SHA256(digest_{n-1} || entry_n)，digest_{-1} 为空前缀。
 * 修改、删除或重排任意一条记录都会改变之后所有摘要。
 * 非线程安全，由写入方串行化访问。
 * </p>
 */
public class HashChain {

    private byte[] state = new byte[0];
    private long length;

    public HashChain() {
    }

    /**
     * 从已知锚点继续（用于重放日志后续写）
     */
    public HashChain(byte[] anchor, long length) {
        this.state = anchor.clone();
        this.length = length;
    }

    public byte[] next(byte[] entry) {
        MessageDigest md = Digests.newSha256();
        md.update(state);
        md.update(entry);
        state = md.digest();
        length++;
        return state.clone();
    }

    public String nextHex(String line) {
        return Digests.toHex(next(line.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * 当前锚点，空链返回空串
     */
    public String digestHex() {
        return Digests.toHex(state);
    }

    public long length() {
        return length;
    }

    public HashChain copy() {
        return new HashChain(state, length);
    }

    public static HashChain replay(Iterable<String> lines) {
        HashChain chain = new HashChain();
        for (String line : lines) {
            chain.nextHex(line);
        }
        return chain;
    }
}
