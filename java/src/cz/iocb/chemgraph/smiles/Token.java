package cz.iocb.chemgraph.smiles;



class Token
{
    final TokenType type;
    final String text;
    final int position;


    Token(TokenType type, String text, int position)
    {
        this.type = type;
        this.text = text;
        this.position = position;
    }


    /**
     * @return ring closure number of a RING_CLOSURE token
     */
    int getRingNumber()
    {
        return Integer.parseInt(text.startsWith("%") ? text.substring(1) : text);
    }


    @Override
    public String toString()
    {
        return type + "(" + text + ")@" + position;
    }
}
