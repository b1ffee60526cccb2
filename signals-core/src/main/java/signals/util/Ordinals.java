package signals.util;

/**
 * English ordinal suffixes for diagnostics ("1st", "2nd", "3rd", "11th").
 */
public final class Ordinals {

  private Ordinals() {
  }

  /**
   * @param number a non-negative position
   * @return the number with its ordinal suffix
   */
  public static String of(int number) {
    switch (number % 100) {
      case 11:
      case 12:
      case 13:
        return number + "th";
      default:
        break;
    }
    switch (number % 10) {
      case 1:
        return number + "st";
      case 2:
        return number + "nd";
      case 3:
        return number + "rd";
      default:
        return number + "th";
    }
  }
}
