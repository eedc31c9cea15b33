package com.realdb.storage;

/**
 * FilterPredicate - filter使用的比较谓词
 *
 * test(fieldValue, operand): 左边是记录中的字段值,右边是查询给出的值。
 * 类型不同的两个值无法比较,所有谓词都返回false。
 */
public enum FilterPredicate {

    /** 等于 */
    EQUAL("=="),
    /** 小于 */
    LESS_THAN("<"),
    /** 小于等于 */
    LESS_EQUAL("<="),
    /** 大于 */
    GREATER_THAN(">"),
    /** 大于等于 */
    GREATER_EQUAL(">=");

    private final String symbol;

    FilterPredicate(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 对字段值求值谓词
     *
     * @param fieldValue 记录中的字段值
     * @param operand 查询给出的比较值
     * @return 是否满足
     */
    public boolean test(Value fieldValue, Value operand) {
        Integer cmp = fieldValue.compare(operand);
        if (cmp == null) {
            return false;
        }

        switch (this) {
            case EQUAL:
                return cmp == 0;
            case LESS_THAN:
                return cmp < 0;
            case LESS_EQUAL:
                return cmp <= 0;
            case GREATER_THAN:
                return cmp > 0;
            case GREATER_EQUAL:
                return cmp >= 0;
            default:
                throw new IllegalStateException("Unknown predicate: " + this);
        }
    }

    /**
     * 根据符号获取谓词
     *
     * @param symbol 谓词符号
     * @return 谓词,未知返回null
     */
    public static FilterPredicate fromSymbol(String symbol) {
        for (FilterPredicate predicate : values()) {
            if (predicate.symbol.equals(symbol)) {
                return predicate;
            }
        }
        return null;
    }
}
