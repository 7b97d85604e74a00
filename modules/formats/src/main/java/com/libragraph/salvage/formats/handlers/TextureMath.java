package com.libragraph.salvage.formats.handlers;

/**
 * Block-compressed texture size arithmetic shared by the DDS and DDX measurers.
 */
final class TextureMath {

    private static final int MAX_MIPS = 16;

    private TextureMath() {
    }

    /**
     * Size of a full mip chain of 4x4 blocks, top level included.
     */
    static long mipChainSize(int width, int height, int mipCount, int bytesPerBlock) {
        long total = blocks(width) * blocks(height) * bytesPerBlock;
        int mipWidth = width;
        int mipHeight = height;
        for (int i = 1; i < Math.min(mipCount, MAX_MIPS); i++) {
            mipWidth = Math.max(1, mipWidth / 2);
            mipHeight = Math.max(1, mipHeight / 2);
            total += Math.max(1, blocks(mipWidth)) * Math.max(1, blocks(mipHeight)) * bytesPerBlock;
        }
        return total;
    }

    static boolean isPowerOfTwo(int x) {
        return x > 0 && (x & (x - 1)) == 0;
    }

    private static long blocks(int pixels) {
        return (pixels + 3) / 4;
    }
}
