package cz.iocb.chemgraph.molecule;



public class AtomicNumbers
{
    public static final byte WILDCARD = 0;

    public static final byte H = 1;
    public static final byte B = 5;
    public static final byte C = 6;
    public static final byte N = 7;
    public static final byte O = 8;
    public static final byte F = 9;
    public static final byte Si = 14;
    public static final byte P = 15;
    public static final byte S = 16;
    public static final byte Cl = 17;
    public static final byte Ge = 32;
    public static final byte As = 33;
    public static final byte Se = 34;
    public static final byte Br = 35;
    public static final byte Te = 52;
    public static final byte I = 53;
}
