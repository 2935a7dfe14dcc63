package com.spring.fateweaver.engine.fate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "d20", "2d6+3", "1d8-1" 형식의 주사위 표기
 */
public record DiceNotation(int count, int sides, int bonus) {

    private static final Pattern NOTATION = Pattern.compile("^(\\d*)d(\\d+)([+-]\\d+)?$");

    public DiceNotation {
        if (count < 1 || count > 100) throw new IllegalArgumentException("dice count out of range: " + count);
        if (sides < 2 || sides > 1000) throw new IllegalArgumentException("dice sides out of range: " + sides);
    }

    public static DiceNotation parse(String notation) {
        if (notation == null) throw new IllegalArgumentException("dice notation is required");
        Matcher m = NOTATION.matcher(notation.trim().toLowerCase(Locale.ROOT).replace(" ", ""));
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid dice notation: " + notation);
        }
        int count = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
        int sides = Integer.parseInt(m.group(2));
        int bonus = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
        return new DiceNotation(count, sides, bonus);
    }

    public boolean isD20() {
        return count == 1 && sides == 20;
    }

    public List<Integer> roll(DiceRoller roller) {
        List<Integer> rolls = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rolls.add(roller.roll(sides));
        }
        return rolls;
    }

    @Override
    public String toString() {
        String base = count + "d" + sides;
        if (bonus > 0) return base + "+" + bonus;
        if (bonus < 0) return base + bonus;
        return base;
    }
}
