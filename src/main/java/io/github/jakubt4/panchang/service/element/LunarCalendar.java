package io.github.jakubt4.panchang.service.element;

/**
 * Month and season of the lunisolar year.
 *
 * @param masa  amanta lunar month; intercalary months are not detected
 * @param ayana Uttarayana or Dakshinayana
 * @param ritu  season, two months each, Vasanta first
 */
public record LunarCalendar(Masa masa, String ayana, String ritu) {
}
