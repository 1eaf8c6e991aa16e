package com.backoffice.domain.vo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * 금액을 나타내는 Value Object
 * 소수점 둘째 자리(scale 2)의 BigDecimal로 고정하여 부동소수점 오차 없이 연산합니다.
 */
public class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("금액은 필수입니다");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("금액은 0 이상이어야 합니다");
        }
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 정적 팩토리 메서드
     */
    public static Money of(BigDecimal amount) {
        return new Money(amount);
    }

    public static Money of(String amount) {
        if (amount == null) {
            throw new IllegalArgumentException("금액은 필수입니다");
        }
        return new Money(new BigDecimal(amount));
    }

    public static Money zero() {
        return new Money(BigDecimal.ZERO);
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    /**
     * 금액을 뺍니다
     *
     * @throws IllegalArgumentException 결과가 음수가 되는 경우
     */
    public Money subtract(Money other) {
        BigDecimal result = this.amount.subtract(other.amount);
        if (result.signum() < 0) {
            throw new IllegalArgumentException("금액이 부족합니다");
        }
        return new Money(result);
    }

    public Money multiply(int multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("곱하는 값은 0 이상이어야 합니다");
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(multiplier)));
    }

    /**
     * 금액의 percent(%)에 해당하는 금액을 반올림(HALF_UP)하여 반환합니다.
     */
    public Money percentage(BigDecimal percent) {
        if (percent == null || percent.signum() < 0) {
            throw new IllegalArgumentException("비율은 0 이상이어야 합니다");
        }
        return new Money(this.amount.multiply(percent).divide(HUNDRED, SCALE, RoundingMode.HALF_UP));
    }

    public Money min(Money other) {
        return isGreaterThan(other) ? other : this;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return compareTo(other) >= 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
