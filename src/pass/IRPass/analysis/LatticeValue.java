package pass.IRPass.analysis;

import java.util.Objects;

import ir.value.constants.Constant;

/**
 * Per-variable value of constant propagation: {@link Undef} below every
 * constant, {@link Nac} above them.
 */
public abstract class LatticeValue {

    @Override
    public abstract String toString();

    @Override
    public abstract boolean equals(Object obj);

    @Override
    public abstract int hashCode();

    public boolean isConstant() {
        return this instanceof Const;
    }

    public static LatticeValue meet(LatticeValue v1, LatticeValue v2) {
        if (v1 instanceof Undef)
            return v2;
        if (v2 instanceof Undef)
            return v1;
        if (v1 instanceof Nac || v2 instanceof Nac)
            return Nac.getInstance();
        if (v1.equals(v2))
            return v1;
        else
            return Nac.getInstance();
    }

    public static class Const extends LatticeValue {
        private final Constant value;

        public Const(Constant value) {
            this.value = value;
        }

        public Constant getValue() {
            return value;
        }

        @Override
        public String toString() {
            return "CONST(" + value + ")";
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Const that))
                return false;
            return value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }
    }

    public static class Undef extends LatticeValue {
        private static final Undef INSTANCE = new Undef();

        private Undef() {
        }

        public static Undef getInstance() {
            return INSTANCE;
        }

        @Override
        public String toString() {
            return "Undef";
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Undef;
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }

    public static class Nac extends LatticeValue {
        private static final Nac INSTANCE = new Nac();

        private Nac() {
        }

        public static Nac getInstance() {
            return INSTANCE;
        }

        @Override
        public String toString() {
            return "NAC";
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Nac;
        }

        @Override
        public int hashCode() {
            return 1;
        }
    }
}
