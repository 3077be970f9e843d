package com.bit.hydro.util;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 键编码工具 二进制统一大端
 */
public class ByteUtils {

    private static final byte SEPARATOR = 0x00;

    /**
     * long 类型转 byte[]（大端，字节序即数值序）
     */
    public static byte[] longToBytes(long value) {
        return Longs.toByteArray(value);
    }

    /**
     * byte[] to long
     */
    public static long bytesToLong(byte[] bytes) {
        return Longs.fromByteArray(bytes);
    }

    /**
     * 从 offset 处读取 8 字节 long
     */
    public static long bytesToLong(byte[] bytes, int offset) {
        return Longs.fromBytes(bytes[offset], bytes[offset + 1], bytes[offset + 2], bytes[offset + 3],
                bytes[offset + 4], bytes[offset + 5], bytes[offset + 6], bytes[offset + 7]);
    }

    /**
     * 字符串键段：UTF-8 + 0x00 分隔符，前缀扫描时不会误匹配更长的字符串
     */
    public static byte[] stringSegment(String value) {
        return Bytes.concat(value.getBytes(StandardCharsets.UTF_8), new byte[]{SEPARATOR});
    }

    /**
     * 读取 offset 处的字符串键段（到分隔符为止）
     */
    public static String readStringSegment(byte[] bytes, int offset) {
        int end = offset;
        while (end < bytes.length && bytes[end] != SEPARATOR) {
            end++;
        }
        return new String(bytes, offset, end - offset, StandardCharsets.UTF_8);
    }

    public static byte[] combine(byte[]... parts) {
        return Bytes.concat(parts);
    }

    public static byte[] combine(long... parts) {
        byte[][] encoded = new byte[parts.length][];
        for (int i = 0; i < parts.length; i++) {
            encoded[i] = longToBytes(parts[i]);
        }
        return Bytes.concat(encoded);
    }

    /**
     * 严格大于 key 的最小键（用于把闭区间上界转成开区间）
     */
    public static byte[] successor(byte[] key) {
        return Arrays.copyOf(key, key.length + 1);
    }

    /**
     * 前缀扫描的开区间上界，前缀全为 0xFF 时返回 null（扫描到表尾）
     */
    public static byte[] prefixEnd(byte[] prefix) {
        byte[] end = Arrays.copyOf(prefix, prefix.length);
        for (int i = end.length - 1; i >= 0; i--) {
            if (end[i] != (byte) 0xFF) {
                end[i]++;
                return Arrays.copyOf(end, i + 1);
            }
        }
        return null;
    }

    /**
     * 字节数组转十六进制字符串（日志用）
     */
    public static String bytesToHex(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }
}
