package com.wakelink.schedule;

import com.wakelink.lineage.DeviceLineage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Расчёт следующего пробуждения.
 * <p>
 * Точка отсчёта: всегда фактическое последнее пробуждение устройства, а не ранее
 * запланированное время: так опоздание устройства не накапливается от цикла к циклу.
 * Расписание выбирается в порядке: устройство → площадка → расписание по умолчанию.
 */
public class WakeScheduleCalculator {

  private static final Logger logger = LoggerFactory.getLogger(WakeScheduleCalculator.class);

  private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("h:mma", Locale.US);

  private final WakeSchedule defaultSchedule;
  private final ZoneId defaultZone;

  public WakeScheduleCalculator(WakeSchedule defaultSchedule, ZoneId defaultZone) {
    this.defaultSchedule = defaultSchedule;
    this.defaultZone = defaultZone;
  }

  /**
   * Следующее пробуждение по выражению расписания.
   *
   * @param scheduleExpr Выражение расписания; null или пустое: расписание по умолчанию.
   * @param referenceTime Фактическое последнее пробуждение.
   * @param timezone Часовой пояс площадки; null: пояс по умолчанию.
   * @throws IllegalArgumentException если выражение не поддерживается.
   */
  public NextWake nextWake(String scheduleExpr, Instant referenceTime, ZoneId timezone) {
    WakeSchedule schedule = scheduleExpr == null || scheduleExpr.trim().isEmpty()
        ? defaultSchedule
        : WakeSchedule.parse(scheduleExpr);
    return nextWake(schedule, referenceTime, timezone);
  }

  /**
   * Следующее пробуждение для устройства с учётом наследования расписания площадки.
   *
   * @param lineage Цепочка владения; null для неизвестного устройства.
   */
  public NextWake nextWake(DeviceLineage lineage, Instant referenceTime) {
    if (lineage == null) {
      return nextWake(defaultSchedule, referenceTime, null);
    }
    return nextWake(resolve(lineage.getDeviceSchedule(), lineage.getSiteSchedule()), referenceTime,
        lineage.getTimezone());
  }

  /**
   * Выбирает расписание: собственное устройства, иначе площадки, иначе по умолчанию.
   * Неразбираемое выражение пропускается с предупреждением.
   */
  public WakeSchedule resolve(String deviceExpr, String siteExpr) {
    WakeSchedule own = tryParse(deviceExpr, "устройства");
    if (own != null) {
      return own;
    }
    WakeSchedule inherited = tryParse(siteExpr, "площадки");
    if (inherited != null) {
      logger.debug("Устройство наследует расписание площадки: {}", inherited);
      return inherited;
    }
    return defaultSchedule;
  }

  public NextWake nextWake(WakeSchedule schedule, Instant referenceTime, ZoneId timezone) {
    ZoneId zone = timezone != null ? timezone : defaultZone;
    ZonedDateTime local = referenceTime.atZone(zone);
    ZonedDateTime next;

    if (schedule.getKind() == WakeSchedule.Kind.INTERVAL) {
      next = referenceTime.plus(schedule.getIntervalHours(), ChronoUnit.HOURS).atZone(zone);
    } else {
      // Пробуждение в пределах запланированного часа засчитывается этому часу,
      // поэтому берём первый час строго после текущего.
      Integer nextHour = null;
      for (int hour : schedule.getHours()) {
        if (hour > local.getHour()) {
          nextHour = hour;
          break;
        }
      }
      LocalDate date = local.toLocalDate();
      if (nextHour == null) {
        nextHour = schedule.getHours().get(0);
        date = date.plusDays(1);
      }
      next = date.atTime(nextHour, 0).atZone(zone);
    }

    return new NextWake(next.toInstant(), next, DISPLAY.format(next), schedule);
  }

  private static WakeSchedule tryParse(String expression, String owner) {
    if (expression == null || expression.trim().isEmpty()) {
      return null;
    }
    try {
      return WakeSchedule.parse(expression);
    } catch (IllegalArgumentException e) {
      logger.warn("⚠️ Пропускаем расписание {} '{}': {}", owner, expression, e.getMessage());
      return null;
    }
  }
}
