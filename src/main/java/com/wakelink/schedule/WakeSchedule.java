package com.wakelink.schedule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Разобранное расписание пробуждений с точностью до часа.
 * <p>
 * Поддерживаемые формы (cron "M H * * *" или только поле часов):
 * <ul>
 *   <li>список часов: "0 8,16 * * *" или "8,16";</li>
 *   <li>интервал: "0 *&#47;6 * * *": каждые N часов от фактического пробуждения;</li>
 *   <li>один час: "0 14 * * *";</li>
 *   <li>"*": каждый час.</li>
 * </ul>
 * Поле минут не учитывается: расписание работает только с часами.
 */
public final class WakeSchedule {

  public enum Kind {
    HOURS,
    INTERVAL
  }

  private final Kind kind;
  private final List<Integer> hours;
  private final int intervalHours;

  private WakeSchedule(Kind kind, List<Integer> hours, int intervalHours) {
    this.kind = kind;
    this.hours = hours;
    this.intervalHours = intervalHours;
  }

  public static WakeSchedule hours(Collection<Integer> hours) {
    if (hours.isEmpty()) {
      throw new IllegalArgumentException("Список часов пуст");
    }
    TreeSet<Integer> sorted = new TreeSet<>();
    for (Integer hour : hours) {
      sorted.add(checkHour(hour));
    }
    return new WakeSchedule(Kind.HOURS, Collections.unmodifiableList(new ArrayList<>(sorted)), 0);
  }

  public static WakeSchedule singleHour(int hour) {
    return hours(List.of(hour));
  }

  public static WakeSchedule everyHours(int interval) {
    if (interval < 1 || interval > 24) {
      throw new IllegalArgumentException("Интервал должен быть от 1 до 24 часов: " + interval);
    }
    return new WakeSchedule(Kind.INTERVAL, List.of(), interval);
  }

  /**
   * Разбирает выражение расписания.
   *
   * @throws IllegalArgumentException если выражение не поддерживается.
   */
  public static WakeSchedule parse(String expression) {
    if (expression == null || expression.trim().isEmpty()) {
      throw new IllegalArgumentException("Пустое выражение расписания");
    }
    String[] parts = expression.trim().split("\\s+");
    String hourField;
    if (parts.length == 5) {
      hourField = parts[1];
    } else if (parts.length == 1) {
      hourField = parts[0];
    } else {
      throw new IllegalArgumentException("Неподдерживаемое выражение расписания: " + expression);
    }

    if ("*".equals(hourField)) {
      List<Integer> all = new ArrayList<>();
      for (int h = 0; h < 24; h++) {
        all.add(h);
      }
      return hours(all);
    }
    if (hourField.startsWith("*/")) {
      return everyHours(parseNumber(hourField.substring(2), expression));
    }
    List<Integer> hours = new ArrayList<>();
    for (String token : hourField.split(",")) {
      hours.add(parseNumber(token.trim(), expression));
    }
    return hours(hours);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Часы по возрастанию (для HOURS).
   */
  public List<Integer> getHours() {
    return hours;
  }

  public int getIntervalHours() {
    return intervalHours;
  }

  @Override
  public String toString() {
    return kind == Kind.HOURS ? "hours" + hours : "every " + intervalHours + "h";
  }

  private static int parseNumber(String token, String expression) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Неподдерживаемое выражение расписания: " + expression, e);
    }
  }

  private static int checkHour(Integer hour) {
    if (hour == null || hour < 0 || hour > 23) {
      throw new IllegalArgumentException("Час должен быть от 0 до 23: " + hour);
    }
    return hour;
  }
}
