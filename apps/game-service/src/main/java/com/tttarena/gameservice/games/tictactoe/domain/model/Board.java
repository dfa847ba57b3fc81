package com.tttarena.gameservice.games.tictactoe.domain.model;

import java.util.Arrays;

/**
 * 井字棋棋盘：3x3 网格，按 grid[y][x] 存储（y 为行，x 为列）。
 * 一旦落子，格子只会在整盘清空时恢复为 EMPTY。
 */
public class Board {
    /** 棋盘尺寸（3x3） */
    public static final int SIZE = 3;

    private final Piece[][] grid = new Piece[SIZE][SIZE];

    public Board() {
        for (int i = 0; i < SIZE; i++) Arrays.fill(grid[i], Piece.EMPTY);
    }

    /** 是否在棋盘内 */
    public boolean inBounds(int x, int y) {
        return x >= 0 && x < SIZE && y >= 0 && y < SIZE;
    }

    public Piece get(int x, int y) { return grid[y][x]; }

    /** 该点是否为空（越界视为非空） */
    public boolean isEmpty(int x, int y) {
        return inBounds(x, y) && grid[y][x] == Piece.EMPTY;
    }

    /** 在(x,y)落子（不做合法性校验，由上层规则判定） */
    public void place(int x, int y, Piece piece) { grid[y][x] = piece; }

    /**
     * 从左到右、从上到下找第一个空位。
     * @return {x, y}，棋盘已满时返回 null
     */
    public int[] firstEmpty() {
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                if (grid[y][x] == Piece.EMPTY) return new int[]{x, y};
            }
        }
        return null;
    }

    /** 权重视图副本（序列化用），weights()[y][x] */
    public int[][] weights() {
        int[][] v = new int[SIZE][SIZE];
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) v[y][x] = grid[y][x].weight();
        }
        return v;
    }

    /** 紧凑字符串（'.'/'X'/'O'，按行），长度 9 */
    public String compact() {
        StringBuilder sb = new StringBuilder(SIZE * SIZE);
        for (Piece[] row : grid) {
            for (Piece p : row) sb.append(p.symbol());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board)) return false;
        return Arrays.deepEquals(grid, ((Board) o).grid);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(grid);
    }

    @Override
    public String toString() {
        return compact();
    }
}
