package pass.IRPass.analysis;

/**
 * A memory region the alias analysis tells apart: one per static
 * {@code alloc}, plus {@link #EXTERNAL} for memory the function did not
 * allocate itself.
 */
public record AbstractLocation(String site) {
    public static final AbstractLocation EXTERNAL = new AbstractLocation("<external>");

    public static AbstractLocation allocSite(String block, int index, String dest) {
        return new AbstractLocation(block + "." + index + ":" + dest);
    }

    public boolean isExternal() {
        return this.equals(EXTERNAL);
    }

    @Override
    public String toString() {
        return site;
    }
}
